package sfuzz.model.wgsl;

import java.util.Objects;

/**
 * A float literal, kept as written in the source (including any suffix)
 *
 */
public class WgslFloatLiteral extends WgslExpression {

	private final String text;

	public WgslFloatLiteral(String text) {
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
		WgslFloatLiteral that = (WgslFloatLiteral) o;
		return Objects.equals(text, that.text);
	}

	@Override
	public int hashCode() {
		return Objects.hash(text);
	}
}
