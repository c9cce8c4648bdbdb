package sfuzz.reduce;

import sfuzz.errors.IssueContext;
import sfuzz.model.wgsl.AugmentedNode;
import sfuzz.model.wgsl.WgslASTUtil;
import sfuzz.model.wgsl.WgslNode;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Finds the augmented nodes of a tree, so that a reduction driver can address mutations by id rather than by their
 * (unstable) position in the tree.
 */
public class AugmentedNodeCollector {
	private final List<AugmentedNode> nodes = new ArrayList<>();
	private final TreeMap<Integer, List<AugmentedNode>> byId = new TreeMap<>();

	public AugmentedNodeCollector(WgslNode root) {
		for (WgslNode node : WgslASTUtil.nodesPreOrder(root)) {
			if (node instanceof AugmentedNode) {
				AugmentedNode augmented = (AugmentedNode) node;
				nodes.add(augmented);
				byId.computeIfAbsent(augmented.getId(), k -> new ArrayList<>()).add(augmented);
			}
		}
	}

	/**
	 * @return every augmented node, parents before children
	 */
	public List<AugmentedNode> getNodes() {
		return Collections.unmodifiableList(nodes);
	}

	/**
	 * @return the nodes created by the mutation with the given id; one mutation may leave several markers
	 */
	public List<AugmentedNode> getNodesWithId(int id) {
		return Collections.unmodifiableList(byId.getOrDefault(id, Collections.emptyList()));
	}

	public SortedSet<Integer> getIds() {
		return new TreeSet<>(byId.keySet());
	}

	/**
	 * @return the largest id in the tree, or 0 if there are no augmented nodes
	 */
	public int getMaxId() {
		return byId.isEmpty() ? 0 : byId.lastKey();
	}

	public void checkIdsPresent(IssueContext ctx, Collection<Integer> ids) {
		for (int id : ids) {
			if (!byId.containsKey(id)) {
				ctx.error(new UnknownMutationIdIssue(id));
			}
		}
	}
}
