package sfuzz.model.type;

import java.util.Objects;

/**
 * Represents an array. The element count is null for a runtime-sized array.
 *
 * Two runtime-sized arrays with equal element types compare equal.
 */
public class ArrayType extends Type {
	private final Type elementType;
	private final Integer elementCount;

	public ArrayType(Type elementType, Integer elementCount) {
		if (elementCount != null && elementCount <= 0) {
			throw new IllegalArgumentException("array element count must be positive, got " + elementCount);
		}
		this.elementType = elementType;
		this.elementCount = elementCount;
	}

	public Type getElementType() {
		return elementType;
	}

	public Integer getElementCount() {
		return elementCount;
	}

	public boolean isRuntimeSized() {
		return elementCount == null;
	}

	@Override
	public boolean isAbstract() {
		return elementType.isAbstract();
	}

	@Override
	public int hashCode() {
		return Objects.hash(elementType, elementCount) * 29 + 3;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) return true;
		if (!(obj instanceof ArrayType)) return false;
		ArrayType other = (ArrayType) obj;
		return elementType.equals(other.elementType) && Objects.equals(elementCount, other.elementCount);
	}

	@Override
	public <T, E extends Throwable> T accept(TypeVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
