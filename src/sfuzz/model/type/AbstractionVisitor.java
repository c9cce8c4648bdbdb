package sfuzz.model.type;

import java.util.Objects;

/**
 * Decides whether the visited type is an abstraction of a fixed, possibly more concrete, type. Equality is handled by
 * {@link TypeLattice#isAbstractionOf(Type, Type)} before this visitor is consulted.
 */
public class AbstractionVisitor extends TypeVisitor<Boolean, RuntimeException> {
	private final Type specific;

	public AbstractionVisitor(Type specific) {
		this.specific = specific;
	}

	@Override
	public Boolean visit(BoolType boolType) throws RuntimeException {
		return false;
	}

	@Override
	public Boolean visit(I32Type i32Type) throws RuntimeException {
		return false;
	}

	@Override
	public Boolean visit(U32Type u32Type) throws RuntimeException {
		return false;
	}

	@Override
	public Boolean visit(AbstractIntType abstractIntType) throws RuntimeException {
		// integer literals may also be used where a float is expected
		return specific instanceof I32Type ||
				specific instanceof U32Type ||
				specific instanceof AbstractFloatType ||
				specific instanceof F32Type ||
				specific instanceof F16Type;
	}

	@Override
	public Boolean visit(F16Type f16Type) throws RuntimeException {
		return false;
	}

	@Override
	public Boolean visit(F32Type f32Type) throws RuntimeException {
		return false;
	}

	@Override
	public Boolean visit(AbstractFloatType abstractFloatType) throws RuntimeException {
		return specific instanceof F16Type || specific instanceof F32Type;
	}

	@Override
	public Boolean visit(VectorType vectorType) throws RuntimeException {
		if (!(specific instanceof VectorType)) {
			return false;
		}
		VectorType other = (VectorType) specific;
		return vectorType.getWidth() == other.getWidth() &&
				TypeLattice.isAbstractionOf(vectorType.getElementType(), other.getElementType());
	}

	@Override
	public Boolean visit(MatrixType matrixType) throws RuntimeException {
		if (!(specific instanceof MatrixType)) {
			return false;
		}
		MatrixType other = (MatrixType) specific;
		return matrixType.getNumCols() == other.getNumCols() &&
				matrixType.getNumRows() == other.getNumRows() &&
				TypeLattice.isAbstractionOf(matrixType.getElementType(), other.getElementType());
	}

	@Override
	public Boolean visit(ArrayType arrayType) throws RuntimeException {
		if (!(specific instanceof ArrayType)) {
			return false;
		}
		ArrayType other = (ArrayType) specific;
		return Objects.equals(arrayType.getElementCount(), other.getElementCount()) &&
				TypeLattice.isAbstractionOf(arrayType.getElementType(), other.getElementType());
	}

	@Override
	public Boolean visit(ReferenceType referenceType) throws RuntimeException {
		return TypeLattice.isAbstractionOf(referenceType.getStoreType(), specific);
	}
}
