package sfuzz.model.wgsl;

import java.util.Objects;

public class WgslParen extends WgslExpression {

	private final WgslExpression target;

	public WgslParen(WgslExpression target) {
		this.target = target;
	}

	public WgslExpression getTarget() {
		return target;
	}

	@Override
	public <T, E extends Throwable> T accept(WgslExpressionVisitor<T, E> visitor) throws E {
		return visitor.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		WgslParen paren = (WgslParen) o;
		return Objects.equals(target, paren.target);
	}

	@Override
	public int hashCode() {
		return Objects.hash(target);
	}
}
