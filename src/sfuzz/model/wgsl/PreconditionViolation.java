package sfuzz.model.wgsl;

import sfuzz.InternalFuzzerError;

/**
 * Raised when a mutation or reduction step calls into the augmented node model in a way that breaks its
 * preconditions. This indicates a bug in the caller, not bad input.
 */
public abstract class PreconditionViolation extends InternalFuzzerError {
	public PreconditionViolation(String message) {
		super(message);
	}
}
