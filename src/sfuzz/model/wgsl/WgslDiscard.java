package sfuzz.model.wgsl;

public class WgslDiscard extends WgslStatement {

	@Override
	public <T, E extends Throwable> T accept(WgslStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		return o != null && getClass() == o.getClass();
	}

	@Override
	public int hashCode() {
		return 31;
	}
}
