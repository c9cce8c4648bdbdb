package sfuzz.model.wgsl;

import java.util.Objects;

public class WgslWhile extends WgslStatement {
	private final WgslExpression cond;
	private final WgslCompound body;

	public WgslWhile(WgslExpression cond, WgslCompound body) {
		this.cond = cond;
		this.body = body;
	}

	public WgslExpression getCond() {
		return cond;
	}

	public WgslCompound getBody() {
		return body;
	}

	@Override
	public <T, E extends Throwable> T accept(WgslStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		WgslWhile that = (WgslWhile) o;
		return Objects.equals(cond, that.cond) && Objects.equals(body, that.body);
	}

	@Override
	public int hashCode() {
		return Objects.hash(cond, body);
	}
}
