package sfuzz.reduce;

import org.junit.Test;
import sfuzz.errors.TopLevelIssueContext;
import sfuzz.model.wgsl.*;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.Assert.*;
import static sfuzz.model.wgsl.WgslBuilder.*;

public class AugmentedNodeCollectorTest {

	private static WgslStatement tree() {
		return block(
				deletable(4, assign(id("x"), new ReverseToLhsBinop(2, null, times(id("x"), num("1"))))),
				ifTrueWrapper(7, ret(new AddedParen(1, null, id("x")))));
	}

	@Test
	public void collectsIdsInOrder() {
		AugmentedNodeCollector collector = new AugmentedNodeCollector(tree());
		assertEquals(Arrays.asList(1, 2, 4, 7), Arrays.asList(collector.getIds().toArray()));
		assertEquals(7, collector.getMaxId());
		assertEquals(6, collector.getNodes().size());
	}

	@Test(expected = UnsupportedOperationException.class)
	public void nodesWithIdCannotBeModified() {
		AugmentedNodeCollector collector = new AugmentedNodeCollector(tree());
		collector.getNodesWithId(4).clear();
	}

	@Test
	public void oneMutationMayLeaveSeveralMarkers() {
		AugmentedNodeCollector collector = new AugmentedNodeCollector(tree());
		assertEquals(3, collector.getNodesWithId(7).size());
		assertTrue(collector.getNodesWithId(7).get(0) instanceof ControlFlowWrapper);
		assertEquals(Collections.emptyList(), collector.getNodesWithId(5));
	}

	@Test
	public void emptyTree() {
		AugmentedNodeCollector collector = new AugmentedNodeCollector(block(ret()));
		assertTrue(collector.getIds().isEmpty());
		assertEquals(0, collector.getMaxId());
	}

	@Test
	public void checkIdsPresentReportsUnknownIds() {
		AugmentedNodeCollector collector = new AugmentedNodeCollector(tree());
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		collector.checkIdsPresent(ctx, Arrays.asList(1, 3, 7, 9));
		assertEquals(2, ctx.getIssues().size());
		assertEquals(3, ((UnknownMutationIdIssue) ctx.getIssues().get(0)).getId());
		assertEquals(9, ((UnknownMutationIdIssue) ctx.getIssues().get(1)).getId());
	}

	@Test
	public void generatorContinuesAfterCollectedIds() {
		MutationIdGenerator generator = new MutationIdGenerator(new AugmentedNodeCollector(tree()).getMaxId());
		assertEquals(8, generator.next());
	}
}
