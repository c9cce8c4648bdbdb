package sfuzz.model.wgsl;

/**
 * What should take the place of an augmented node once its mutation is undone: either another node, or nothing.
 *
 * Splicing the result into the parent is up to the caller; a deleted statement should be dropped from its enclosing
 * statement list rather than leaving a gap.
 */
public abstract class ReversalResult {

	public abstract <T, E extends Throwable> T accept(ReversalResultVisitor<T, E> v) throws E;

	@Override
	public abstract boolean equals(Object other);

	@Override
	public abstract int hashCode();

}
