package sfuzz.model.wgsl;

import java.util.List;

/**
 * The original statements inside a {@link ControlFlowWrapper}, correlated to the wrapper by id.
 */
public class WrappedOriginalStatements extends AugmentedCompound {

	public WrappedOriginalStatements(int id, String commentary, List<WgslStatement> statements) {
		super(id, commentary, statements);
	}

	@Override
	public ReversalResult reverse(WgslNode current) {
		if (!(current instanceof WgslCompound)) {
			throw new NodeShapeMismatchError(this, current, "a compound statement");
		}
		return new ReplaceWithNode(new WgslCompound(((WgslCompound) current).getStatements()));
	}

	@Override
	protected String describe() {
		return "wrapped original statements " + getId();
	}

	@Override
	public <T, E extends Throwable> T accept(WgslStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
