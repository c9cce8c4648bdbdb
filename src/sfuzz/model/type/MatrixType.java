package sfuzz.model.type;

import java.util.Objects;

/**
 * Represents matCxR&lt;T&gt;, a matrix of C columns and R rows of floating point elements.
 */
public class MatrixType extends Type {
	private final int numCols;
	private final int numRows;
	private final FloatType elementType;

	public MatrixType(int numCols, int numRows, FloatType elementType) {
		if (numCols < 2 || numCols > 4 || numRows < 2 || numRows > 4) {
			throw new IllegalArgumentException(
					"matrix dimensions must be between 2 and 4, got " + numCols + "x" + numRows);
		}
		this.numCols = numCols;
		this.numRows = numRows;
		this.elementType = elementType;
	}

	public int getNumCols() {
		return numCols;
	}

	public int getNumRows() {
		return numRows;
	}

	public FloatType getElementType() {
		return elementType;
	}

	@Override
	public boolean isAbstract() {
		return elementType.isAbstract();
	}

	@Override
	public int hashCode() {
		return Objects.hash(numCols, numRows, elementType) * 23 + 2;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) return true;
		if (!(obj instanceof MatrixType)) return false;
		MatrixType other = (MatrixType) obj;
		return numCols == other.numCols && numRows == other.numRows && elementType.equals(other.elementType);
	}

	@Override
	public <T, E extends Throwable> T accept(TypeVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
