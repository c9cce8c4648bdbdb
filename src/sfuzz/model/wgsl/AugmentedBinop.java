package sfuzz.model.wgsl;

import java.io.IOException;
import java.util.Objects;

/**
 * A binary expression introduced by a mutation, typically an identity operation such as {@code (x) + (0)}, that can be
 * collapsed to one of its operands.
 */
public abstract class AugmentedBinop extends WgslBinop implements AugmentedNode {
	private final int id;
	private final String commentary;

	protected AugmentedBinop(int id, String commentary, Operation op, WgslExpression lhs, WgslExpression rhs) {
		super(op, lhs, rhs);
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

	protected abstract WgslExpression keptOperand(WgslBinop binop);

	@Override
	public ReversalResult reverse(WgslNode current) {
		if (!(current instanceof WgslBinop)) {
			throw new NodeShapeMismatchError(this, current, "a binary expression");
		}
		return new ReplaceWithNode(keptOperand((WgslBinop) current));
	}

	@Override
	public void emitCommentary(CommentarySink sink) throws IOException {
		if (commentary != null) {
			sink.write("/* " + commentary + " */ ");
		}
	}

	@Override
	public boolean equals(Object o) {
		if (!super.equals(o)) return false;
		AugmentedBinop that = (AugmentedBinop) o;
		return id == that.id && Objects.equals(commentary, that.commentary);
	}

	@Override
	public int hashCode() {
		return Objects.hash(super.hashCode(), id, commentary);
	}
}
