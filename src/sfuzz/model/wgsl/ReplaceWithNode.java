package sfuzz.model.wgsl;

import java.util.Objects;

public class ReplaceWithNode extends ReversalResult {
	private final WgslNode replacement;

	public ReplaceWithNode(WgslNode replacement) {
		this.replacement = replacement;
	}

	public WgslNode getReplacement() {
		return replacement;
	}

	@Override
	public <T, E extends Throwable> T accept(ReversalResultVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		ReplaceWithNode that = (ReplaceWithNode) o;
		return Objects.equals(replacement, that.replacement);
	}

	@Override
	public int hashCode() {
		return Objects.hash(replacement);
	}

	@Override
	public String toString() {
		return "ReplaceWithNode(" + replacement + ")";
	}
}
