package sfuzz.model.wgsl;

/**
 * A WGSL expression base class
 *
 */
public abstract class WgslExpression extends WgslNode {

	public abstract <T, E extends Throwable> T accept(WgslExpressionVisitor<T, E> visitor) throws E;

	@Override
	public <T, E extends Throwable> T accept(WgslNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
