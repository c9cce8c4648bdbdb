package sfuzz.model.type;

/**
 * The type of a floating point literal before it is concretized.
 */
public class AbstractFloatType extends FloatType {
	@Override
	public boolean isAbstract() {
		return true;
	}

	@Override
	public int hashCode() {
		return 17;
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof AbstractFloatType;
	}

	@Override
	public <T, E extends Throwable> T accept(TypeVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
