package sfuzz.model.wgsl;

import java.util.HashMap;
import java.util.Map;

/**
 * Lookup from id to the {@link WrappedOriginalStatements} carrying it within a subtree. Keeps control flow wrappers
 * free of back-pointers into their own contents.
 */
public class WrappedStatementsIndex {
	private final Map<Integer, WrappedOriginalStatements> byId = new HashMap<>();

	public WrappedStatementsIndex(WgslNode root) {
		for (WgslNode node : WgslASTUtil.nodesPreOrder(root)) {
			if (node instanceof WrappedOriginalStatements) {
				WrappedOriginalStatements wrapped = (WrappedOriginalStatements) node;
				byId.putIfAbsent(wrapped.getId(), wrapped);
			}
		}
	}

	/**
	 * @return the outermost wrapped statements with the given id, or null if there are none
	 */
	public WrappedOriginalStatements get(int id) {
		return byId.get(id);
	}

	public boolean contains(int id) {
		return byId.containsKey(id);
	}
}
