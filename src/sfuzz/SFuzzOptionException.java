package sfuzz;

public class SFuzzOptionException extends Exception {
	private static final long serialVersionUID = -6394021770154829563L;

	public SFuzzOptionException(String message) {
		super(message);
	}
}
