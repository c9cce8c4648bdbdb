package sfuzz.model.type;

public enum AccessMode {
	READ("read"),
	WRITE("write"),
	READ_WRITE("read_write"),
	;

	private final String wgslName;

	AccessMode(String wgslName) {
		this.wgslName = wgslName;
	}

	public String getWgslName() {
		return wgslName;
	}

	public static AccessMode fromWgslName(String name) {
		for (AccessMode mode : values()) {
			if (mode.wgslName.equals(name)) {
				return mode;
			}
		}
		throw new IllegalArgumentException("unknown access mode \"" + name + "\"");
	}
}
