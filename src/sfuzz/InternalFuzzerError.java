package sfuzz;

public class InternalFuzzerError extends RuntimeException {
	public InternalFuzzerError() {
		super("internal fuzzer error");
	}

	public InternalFuzzerError(String message) {
		super("internal fuzzer error: " + message);
	}

	public InternalFuzzerError(Exception e) {
		super("internal fuzzer error", e);
	}
}
