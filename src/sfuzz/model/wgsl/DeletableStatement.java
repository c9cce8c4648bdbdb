package sfuzz.model.wgsl;

/**
 * A statement added by a mutation, which can be removed outright.
 */
public class DeletableStatement extends AugmentedStatement {

	public DeletableStatement(int id, String commentary, WgslStatement statement) {
		super(id, commentary, statement);
	}

	@Override
	public ReversalResult reverse(WgslNode current) {
		return new DeleteNode();
	}

	@Override
	protected String describe() {
		return "deletable statement";
	}

	@Override
	public <T, E extends Throwable> T accept(WgslStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
