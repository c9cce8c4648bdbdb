package sfuzz.model.type;

/**
 * Represents the 32-bit signed integer type i32.
 */
public class I32Type extends IntegerType {
	@Override
	public int hashCode() {
		return 3;
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof I32Type;
	}

	@Override
	public <T, E extends Throwable> T accept(TypeVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
