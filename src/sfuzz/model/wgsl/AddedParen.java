package sfuzz.model.wgsl;

import java.io.IOException;
import java.util.Objects;

/**
 * Parentheses introduced by a mutation around an expression that did not need them.
 */
public class AddedParen extends WgslParen implements AugmentedNode {
	private final int id;
	private final String commentary;

	public AddedParen(int id, String commentary, WgslExpression target) {
		super(target);
		this.id = id;
		this.commentary = commentary;
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
		if (!(current instanceof WgslParen)) {
			throw new NodeShapeMismatchError(this, current, "a parenthesized expression");
		}
		return new ReplaceWithNode(((WgslParen) current).getTarget());
	}

	@Override
	public void emitCommentary(CommentarySink sink) throws IOException {
		if (commentary != null) {
			sink.write("/* " + commentary + " */ ");
		}
	}

	@Override
	public <T, E extends Throwable> T accept(WgslExpressionVisitor<T, E> visitor) throws E {
		return visitor.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (!super.equals(o)) return false;
		AddedParen that = (AddedParen) o;
		return id == that.id && Objects.equals(commentary, that.commentary);
	}

	@Override
	public int hashCode() {
		return Objects.hash(super.hashCode(), id, commentary);
	}
}
