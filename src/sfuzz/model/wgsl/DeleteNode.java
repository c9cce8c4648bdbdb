package sfuzz.model.wgsl;

public class DeleteNode extends ReversalResult {

	@Override
	public <T, E extends Throwable> T accept(ReversalResultVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		return o instanceof DeleteNode;
	}

	@Override
	public int hashCode() {
		return 37;
	}

	@Override
	public String toString() {
		return "DeleteNode";
	}
}
