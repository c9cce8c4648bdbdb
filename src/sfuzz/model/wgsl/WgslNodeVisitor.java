package sfuzz.model.wgsl;

public abstract class WgslNodeVisitor<T, E extends Throwable> {

	public abstract T visit(WgslExpression expression) throws E;
	public abstract T visit(WgslStatement statement) throws E;
}
