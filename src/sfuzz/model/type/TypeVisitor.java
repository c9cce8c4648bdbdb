package sfuzz.model.type;

public abstract class TypeVisitor<T, E extends Throwable> {
	public abstract T visit(BoolType boolType) throws E;
	public abstract T visit(I32Type i32Type) throws E;
	public abstract T visit(U32Type u32Type) throws E;
	public abstract T visit(AbstractIntType abstractIntType) throws E;
	public abstract T visit(F16Type f16Type) throws E;
	public abstract T visit(F32Type f32Type) throws E;
	public abstract T visit(AbstractFloatType abstractFloatType) throws E;
	public abstract T visit(VectorType vectorType) throws E;
	public abstract T visit(MatrixType matrixType) throws E;
	public abstract T visit(ArrayType arrayType) throws E;
	public abstract T visit(ReferenceType referenceType) throws E;
}
