package sfuzz.model.type;

public enum AddressSpace {
	FUNCTION("function"),
	PRIVATE("private"),
	WORKGROUP("workgroup"),
	UNIFORM("uniform"),
	STORAGE("storage"),
	HANDLE("handle"),
	;

	private final String wgslName;

	AddressSpace(String wgslName) {
		this.wgslName = wgslName;
	}

	public String getWgslName() {
		return wgslName;
	}

	public static AddressSpace fromWgslName(String name) {
		for (AddressSpace space : values()) {
			if (space.wgslName.equals(name)) {
				return space;
			}
		}
		throw new IllegalArgumentException("unknown address space \"" + name + "\"");
	}
}
