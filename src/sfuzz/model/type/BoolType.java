package sfuzz.model.type;

/**
 * Represents bool.
 */
public class BoolType extends ScalarType {
	@Override
	public int hashCode() {
		return 2;
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof BoolType;
	}

	@Override
	public <T, E extends Throwable> T accept(TypeVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
