package sfuzz.serialization;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;
import sfuzz.model.wgsl.*;

import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.*;
import static sfuzz.model.wgsl.WgslBuilder.*;

@RunWith(Parameterized.class)
public class WgslJsonRoundTripTest {

	@Parameters(name = "{index}: {0}")
	public static List<Object[]> data() {
		return Arrays.asList(new Object[][] {
				{ new ReverseToLhsBinop(1, "mul by one on right", times(id("x"), flt("1.0"))) },
				{ new ReverseToRhsBinop(2, null, WgslBinop.Operation.BOR, num("0u"), id("flags")) },
				{ assign(id("y"), new AddedParen(3, "parens", new WgslUnary(WgslUnary.Operation.NEGATE, id("x")))) },
				{ block(deletable(4, assign(id("a"), id("a"))), ret(knownTrue(5, not(bool(false))))) },
				{ emptiable(6, new WgslBreak(), new WgslContinue(), new WgslDiscard()) },
				{ new EmptiableCompound(7, "filler", Arrays.asList()) },
				{ new DeadCodeFragment(8, "never runs", ifS(knownFalse(8, bool(false)), block(ret()), block(ret(id("v"))))) },
				{ new DeadCodeFragment(9, null, whileS(knownFalse(9, binop(WgslBinop.Operation.GT, num("0"), num("1"))), block())) },
				{ block(ifTrueWrapper(10, assign(id("i"), plus(id("i"), num("1")))), ret()) },
				{ new ControlFlowWrapper(11, "loop once", whileS(
						knownTrue(11, bool(true)),
						block(new WrappedOriginalStatements(11, "original", Arrays.asList(new WgslDiscard())), new WgslBreak()))) },
		});
	}

	private final WgslNode node;

	public WgslJsonRoundTripTest(WgslNode node) {
		this.node = node;
	}

	@Test
	public void encodeThenDecode() {
		assertEquals(node, WgslJsonDecoder.decodeNode(WgslJsonEncoder.encode(node)));
	}

	@Test
	public void throughText() {
		String text = TreeFiles.toJson(node).toString();
		assertEquals(node, TreeFiles.fromJson(text));
	}
}
