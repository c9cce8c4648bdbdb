package sfuzz.model.wgsl;

import java.util.Objects;

public class WgslAssignment extends WgslStatement {
	private final WgslExpression lhs;
	private final WgslExpression rhs;

	public WgslAssignment(WgslExpression lhs, WgslExpression rhs) {
		this.lhs = lhs;
		this.rhs = rhs;
	}

	public WgslExpression getLHS() {
		return lhs;
	}

	public WgslExpression getRHS() {
		return rhs;
	}

	@Override
	public <T, E extends Throwable> T accept(WgslStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		WgslAssignment that = (WgslAssignment) o;
		return Objects.equals(lhs, that.lhs) && Objects.equals(rhs, that.rhs);
	}

	@Override
	public int hashCode() {
		return Objects.hash(lhs, rhs);
	}
}
