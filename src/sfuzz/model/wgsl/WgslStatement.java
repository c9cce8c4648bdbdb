package sfuzz.model.wgsl;

/**
 * A WGSL statement
 *
 */
public abstract class WgslStatement extends WgslNode {

	public abstract <T, E extends Throwable> T accept(WgslStatementVisitor<T, E> v) throws E;

	@Override
	public <T, E extends Throwable> T accept(WgslNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
