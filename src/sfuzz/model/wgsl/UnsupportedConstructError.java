package sfuzz.model.wgsl;

public class UnsupportedConstructError extends PreconditionViolation {
	private final WgslNode construct;

	public UnsupportedConstructError(String message, WgslNode construct) {
		super(message);
		this.construct = construct;
	}

	public WgslNode getConstruct() {
		return construct;
	}
}
