package sfuzz;

/**
 * An SFuzz exception consisting of a prefix (kind of error) and a message
 *
 */
public abstract class SFuzzException extends RuntimeException {
	private final String msg;
	private final String prefix;

	public SFuzzException(String prefix, String msg) {
		super(prefix + ": " + msg);
		this.prefix = prefix;
		this.msg = msg;
	}

	public SFuzzException(String prefix, String msg, Throwable cause) {
		super(prefix + ": " + msg, cause);
		this.prefix = prefix;
		this.msg = msg;
	}

	public String getMsg() {
		return msg;
	}

	public String getPrefix() {
		return prefix;
	}
}
