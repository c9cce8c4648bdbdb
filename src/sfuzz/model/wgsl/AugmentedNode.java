package sfuzz.model.wgsl;

import java.io.IOException;

/**
 * A node that records a mutation applied to the tree, together with enough information to undo it.
 *
 * Augmented nodes are expressions or statements in their own right, so they may appear anywhere a plain node can.
 * They are never mutated after construction.
 */
public interface AugmentedNode {
	/**
	 * @return the id of the mutation that created this node; several nodes may share the id of one mutation
	 */
	int getId();

	/**
	 * @return human-readable explanation of the mutation, or null
	 */
	String getCommentary();

	/**
	 * Computes what should replace this node to undo its mutation.
	 *
	 * @param current the node occupying this node's position in the tree, which may differ from this node if the tree
	 *                was edited since
	 * @throws NodeShapeMismatchError if current does not have the shape the reversal requires
	 */
	ReversalResult reverse(WgslNode current);

	/**
	 * Writes zero or more comment lines describing the mutation. Has no effect on the tree.
	 */
	void emitCommentary(CommentarySink sink) throws IOException;
}
