package sfuzz.model.wgsl;

/**
 * Statements wrapped in extra control flow that is known not to change their behaviour, for example
 * {@code if (<known true>) { ... }}. The original statements are kept, somewhere inside the wrapping statement, in a
 * {@link WrappedOriginalStatements} compound with the same id.
 */
public class ControlFlowWrapper extends AugmentedStatement {

	public ControlFlowWrapper(int id, String commentary, WgslStatement statement) {
		super(id, commentary, statement);
	}

	@Override
	public ReversalResult reverse(WgslNode current) {
		WrappedOriginalStatements original = new WrappedStatementsIndex(current).get(getId());
		if (original == null) {
			throw new NodeShapeMismatchError(this, current, "wrapped original statements with id " + getId());
		}
		return new ReplaceWithNode(new WgslCompound(original.getStatements()));
	}

	@Override
	protected String describe() {
		return "control flow wrapped " + getId();
	}

	@Override
	public <T, E extends Throwable> T accept(WgslStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
