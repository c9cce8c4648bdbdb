package sfuzz.model.wgsl;

public abstract class ReversalResultVisitor<T, E extends Throwable> {
	public abstract T visit(ReplaceWithNode replaceWithNode) throws E;
	public abstract T visit(DeleteNode deleteNode) throws E;
}
