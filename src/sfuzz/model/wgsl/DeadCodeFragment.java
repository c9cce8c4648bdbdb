package sfuzz.model.wgsl;

/**
 * A statement guaranteed to have no observable effect because it is guarded by a {@link KnownFalse} condition. It is
 * safe to remove it, or to manipulate anything under the guard.
 *
 * Only {@code if} and {@code while} statements are supported.
 */
public class DeadCodeFragment extends AugmentedStatement {

	public DeadCodeFragment(int id, String commentary, WgslStatement statement) {
		super(id, commentary, statement);
		WgslExpression guard;
		if (statement instanceof WgslIf) {
			guard = ((WgslIf) statement).getCond();
		} else if (statement instanceof WgslWhile) {
			guard = ((WgslWhile) statement).getCond();
		} else {
			throw new UnsupportedConstructError(
					"only 'if' and 'while' are supported as dead code fragments, got " +
							statement.getClass().getSimpleName(),
					statement);
		}
		if (!(guard instanceof KnownFalse)) {
			throw new UnsupportedConstructError("the guard of a dead code fragment must be known to be false", statement);
		}
	}

	@Override
	public ReversalResult reverse(WgslNode current) {
		return new DeleteNode();
	}

	@Override
	protected String describe() {
		return "dead code fragment";
	}

	@Override
	public <T, E extends Throwable> T accept(WgslStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
