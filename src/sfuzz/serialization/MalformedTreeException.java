package sfuzz.serialization;

import sfuzz.SFuzzException;

/**
 * Exception raised when a serialized tree or type does not have the expected shape
 *
 */
public class MalformedTreeException extends SFuzzException {

	private static final long serialVersionUID = 2861054389143717290L;
	private static final String prefix = "Malformed Tree";

	public MalformedTreeException(String msg) {
		super(prefix, msg);
	}

	public MalformedTreeException(String msg, Throwable cause) {
		super(prefix, msg, cause);
	}

}
