package sfuzz.model.wgsl;

import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.Assert.*;
import static sfuzz.model.wgsl.WgslBuilder.*;

public class WgslASTUtilTest {

	@Test
	public void childrenOfIfIncludeElse() {
		WgslIf statement = ifS(id("c"), block(new WgslBreak()), block(new WgslContinue()));
		assertEquals(
				Arrays.asList(id("c"), block(new WgslBreak()), block(new WgslContinue())),
				WgslASTUtil.children(statement));
	}

	@Test
	public void leavesHaveNoChildren() {
		assertEquals(Collections.emptyList(), WgslASTUtil.children(id("x")));
		assertEquals(Collections.emptyList(), WgslASTUtil.children(ret()));
	}

	@Test
	public void preOrderVisitsParentsFirst() {
		WgslStatement root = block(assign(id("x"), plus(id("y"), num("1"))));
		List<WgslNode> nodes = WgslASTUtil.nodesPreOrder(root);
		assertEquals(
				Arrays.asList(
						root,
						assign(id("x"), plus(id("y"), num("1"))),
						id("x"),
						plus(id("y"), num("1")),
						id("y"),
						num("1")),
				nodes);
	}

	@Test
	public void preOrderDescendsIntoMarkers() {
		ControlFlowWrapper wrapper = ifTrueWrapper(3, new WgslDiscard());
		List<WgslNode> nodes = WgslASTUtil.nodesPreOrder(wrapper);
		assertSame(wrapper, nodes.get(0));
		assertTrue(nodes.contains(wrapped(3, new WgslDiscard())));
		assertTrue(nodes.contains(knownTrue(3, bool(true))));
		assertTrue(nodes.contains(bool(true)));
	}

	@Test
	public void wrappedStatementsIndex() {
		WgslStatement root = block(
				ifTrueWrapper(1, assign(id("a"), num("1"))),
				ifTrueWrapper(2, assign(id("b"), num("2"))));
		WrappedStatementsIndex index = new WrappedStatementsIndex(root);
		assertTrue(index.contains(1));
		assertTrue(index.contains(2));
		assertFalse(index.contains(3));
		assertNull(index.get(3));
		assertEquals(wrapped(2, assign(id("b"), num("2"))), index.get(2));
	}
}
