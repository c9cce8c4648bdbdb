package sfuzz.model.wgsl;

import java.util.Objects;

/**
 * The if statement. The else branch is null, another {@link WgslIf} or a {@link WgslCompound}.
 *
 */
public class WgslIf extends WgslStatement {
	private final WgslExpression cond;
	private final WgslCompound bThen;
	private final WgslStatement bElse;

	public WgslIf(WgslExpression cond, WgslCompound bThen, WgslStatement bElse) {
		this.cond = cond;
		this.bThen = bThen;
		this.bElse = bElse;
	}

	public WgslExpression getCond() {
		return cond;
	}

	public WgslCompound getThen() {
		return bThen;
	}

	public WgslStatement getElse() {
		return bElse;
	}

	@Override
	public <T, E extends Throwable> T accept(WgslStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		WgslIf anIf = (WgslIf) o;
		return Objects.equals(cond, anIf.cond) &&
				Objects.equals(bThen, anIf.bThen) &&
				Objects.equals(bElse, anIf.bElse);
	}

	@Override
	public int hashCode() {
		return Objects.hash(cond, bThen, bElse);
	}
}
