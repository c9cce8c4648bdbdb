package sfuzz.model.wgsl;

import java.util.Objects;

public class WgslReturn extends WgslStatement {
	// null when returning from a function without a result
	private final WgslExpression value;

	public WgslReturn(WgslExpression value) {
		this.value = value;
	}

	public WgslExpression getValue() {
		return value;
	}

	@Override
	public <T, E extends Throwable> T accept(WgslStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		WgslReturn that = (WgslReturn) o;
		return Objects.equals(value, that.value);
	}

	@Override
	public int hashCode() {
		return Objects.hash(value);
	}
}
