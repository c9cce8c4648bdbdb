package sfuzz.model.type;

/**
 * Represents the 32-bit floating point type f32.
 */
public class F32Type extends FloatType {
	@Override
	public int hashCode() {
		return 13;
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof F32Type;
	}

	@Override
	public <T, E extends Throwable> T accept(TypeVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
