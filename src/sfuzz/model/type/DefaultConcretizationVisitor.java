package sfuzz.model.type;

public class DefaultConcretizationVisitor extends TypeVisitor<Type, RuntimeException> {
	@Override
	public Type visit(BoolType boolType) throws RuntimeException {
		return boolType;
	}

	@Override
	public Type visit(I32Type i32Type) throws RuntimeException {
		return i32Type;
	}

	@Override
	public Type visit(U32Type u32Type) throws RuntimeException {
		return u32Type;
	}

	@Override
	public Type visit(AbstractIntType abstractIntType) throws RuntimeException {
		return new I32Type();
	}

	@Override
	public Type visit(F16Type f16Type) throws RuntimeException {
		return f16Type;
	}

	@Override
	public Type visit(F32Type f32Type) throws RuntimeException {
		return f32Type;
	}

	@Override
	public Type visit(AbstractFloatType abstractFloatType) throws RuntimeException {
		return new F32Type();
	}

	@Override
	public Type visit(VectorType vectorType) throws RuntimeException {
		// concretizing a scalar always yields a scalar
		return new VectorType(vectorType.getWidth(), (ScalarType) vectorType.getElementType().accept(this));
	}

	@Override
	public Type visit(MatrixType matrixType) throws RuntimeException {
		return new MatrixType(
				matrixType.getNumCols(),
				matrixType.getNumRows(),
				(FloatType) matrixType.getElementType().accept(this));
	}

	@Override
	public Type visit(ArrayType arrayType) throws RuntimeException {
		return new ArrayType(arrayType.getElementType().accept(this), arrayType.getElementCount());
	}

	@Override
	public Type visit(ReferenceType referenceType) throws RuntimeException {
		return referenceType;
	}
}
