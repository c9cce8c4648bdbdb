package sfuzz.formatters;

import org.junit.Test;
import sfuzz.errors.TopLevelIssueContext;
import sfuzz.model.type.F16Type;
import sfuzz.model.type.I32Type;
import sfuzz.model.type.NoCommonTypeIssue;
import sfuzz.model.type.VectorType;
import sfuzz.options.OptionParserIssue;
import sfuzz.reduce.UnknownMutationIdIssue;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.Assert.*;

public class IssueFormattingTest {

	@Test
	public void formatsEveryIssue() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		assertFalse(ctx.hasErrors());
		ctx.error(new UnknownMutationIdIssue(7));
		ctx.error(new NoCommonTypeIssue(Arrays.asList(new I32Type(), new VectorType(2, new F16Type()))));
		ctx.error(new OptionParserIssue("Exactly one input tree file is required"));
		assertTrue(ctx.hasErrors());
		assertEquals(
				"Detected 3 issue(s):\n" +
				"no augmented node with mutation id 7 exists in the tree\n" +
				"no common type found among i32, vec2<f16>\n" +
				"option error: Exactly one input tree file is required",
				ctx.format());
	}

	@Test
	public void emptyTypeList() {
		assertEquals(
				"no common type can be found for an empty list of types",
				new NoCommonTypeIssue(Collections.emptyList()).getMessage());
	}
}
