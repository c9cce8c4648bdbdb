package sfuzz.model.wgsl;

public abstract class WgslExpressionVisitor<T, E extends Throwable> {

	public abstract T visit(WgslIdentifier identifier) throws E;
	public abstract T visit(WgslBoolLiteral boolLiteral) throws E;
	public abstract T visit(WgslIntLiteral intLiteral) throws E;
	public abstract T visit(WgslFloatLiteral floatLiteral) throws E;
	public abstract T visit(WgslParen paren) throws E;
	public abstract T visit(WgslUnary unary) throws E;
	public abstract T visit(WgslBinop binop) throws E;

	// augmented expressions
	public abstract T visit(AddedParen addedParen) throws E;
	public abstract T visit(ReverseToLhsBinop reverseToLhsBinop) throws E;
	public abstract T visit(ReverseToRhsBinop reverseToRhsBinop) throws E;
	public abstract T visit(KnownFalse knownFalse) throws E;
	public abstract T visit(KnownTrue knownTrue) throws E;

}
