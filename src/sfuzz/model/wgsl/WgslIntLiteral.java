package sfuzz.model.wgsl;

import java.util.Objects;

/**
 * A int literal, kept as written in the source (including any suffix) so that printing is exact
 *
 */
public class WgslIntLiteral extends WgslExpression {

	private final String text;

	public WgslIntLiteral(String text) {
		this.text = text;
	}

	public String getText() {
		return text;
	}

	@Override
	public <T, E extends Throwable> T accept(WgslExpressionVisitor<T, E> visitor) throws E {
		return visitor.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		WgslIntLiteral that = (WgslIntLiteral) o;
		return Objects.equals(text, that.text);
	}

	@Override
	public int hashCode() {
		return Objects.hash(text);
	}
}
