package sfuzz.model.type;

/**
 * The type of an integer literal before it is concretized. It may concretize to either integer type or, via
 * promotion, to any floating point type.
 */
public class AbstractIntType extends IntegerType {
	@Override
	public boolean isAbstract() {
		return true;
	}

	@Override
	public int hashCode() {
		return 7;
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof AbstractIntType;
	}

	@Override
	public <T, E extends Throwable> T accept(TypeVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
