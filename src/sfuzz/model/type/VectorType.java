package sfuzz.model.type;

import java.util.Objects;

/**
 * Represents vecN&lt;T&gt; for N in 2..4.
 */
public class VectorType extends Type {
	private final int width;
	private final ScalarType elementType;

	public VectorType(int width, ScalarType elementType) {
		if (width < 2 || width > 4) {
			throw new IllegalArgumentException("vector width must be 2, 3 or 4, got " + width);
		}
		this.width = width;
		this.elementType = elementType;
	}

	public int getWidth() {
		return width;
	}

	public ScalarType getElementType() {
		return elementType;
	}

	@Override
	public boolean isAbstract() {
		return elementType.isAbstract();
	}

	@Override
	public int hashCode() {
		return Objects.hash(width, elementType) * 19 + 1;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) return true;
		if (!(obj instanceof VectorType)) return false;
		VectorType other = (VectorType) obj;
		return width == other.width && elementType.equals(other.elementType);
	}

	@Override
	public <T, E extends Throwable> T accept(TypeVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
