package sfuzz.model.wgsl;

import java.io.IOException;
import java.util.Objects;

/**
 * An expression that, on the authority of whoever built it, evaluates to a known boolean without observable side
 * effects. It may therefore be replaced by the corresponding literal without changing the program's meaning.
 */
public abstract class KnownBooleanExpression extends WgslExpression implements AugmentedNode {
	private final int id;
	private final String commentary;
	private final WgslExpression expression;

	protected KnownBooleanExpression(int id, String commentary, WgslExpression expression) {
		this.id = id;
		this.commentary = commentary;
		this.expression = expression;
	}

	public abstract boolean getKnownValue();

	public WgslExpression getExpression() {
		return expression;
	}

	@Override
	public int getId() {
		return id;
	}

	@Override
	public String getCommentary() {
		return commentary;
	}

	@Override
	public ReversalResult reverse(WgslNode current) {
		return new ReplaceWithNode(new WgslBoolLiteral(getKnownValue()));
	}

	@Override
	public void emitCommentary(CommentarySink sink) throws IOException {
		String text = commentary != null ? commentary : "known " + getKnownValue();
		sink.write("/* " + text + " */ ");
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		KnownBooleanExpression that = (KnownBooleanExpression) o;
		return id == that.id &&
				Objects.equals(commentary, that.commentary) &&
				Objects.equals(expression, that.expression);
	}

	@Override
	public int hashCode() {
		return Objects.hash(getClass().getSimpleName(), id, commentary, expression);
	}
}
