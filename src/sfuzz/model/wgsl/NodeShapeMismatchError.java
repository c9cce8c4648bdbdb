package sfuzz.model.wgsl;

/**
 * The node found in the tree where an augmented node is being reversed does not have the shape its reversal rule
 * requires.
 */
public class NodeShapeMismatchError extends PreconditionViolation {
	private final AugmentedNode augmentedNode;
	private final WgslNode actual;

	public NodeShapeMismatchError(AugmentedNode augmentedNode, WgslNode actual, String expected) {
		super("cannot reverse mutation " + augmentedNode.getId() + ": expected " + expected + ", found " +
				(actual == null ? "nothing" : actual.getClass().getSimpleName()));
		this.augmentedNode = augmentedNode;
		this.actual = actual;
	}

	public AugmentedNode getAugmentedNode() {
		return augmentedNode;
	}

	public WgslNode getActual() {
		return actual;
	}
}
