package sfuzz;

import org.apache.commons.io.FileUtils;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import sfuzz.model.wgsl.*;
import sfuzz.serialization.TreeFiles;

import java.io.File;
import java.io.IOException;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;

import static org.junit.Assert.*;
import static sfuzz.model.wgsl.WgslBuilder.*;

public class SFuzzMainTest {

	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	private File input;

	@Before
	public void setup() throws IOException {
		input = folder.newFile("input.json");
		TreeFiles.write(input.toPath(), block(
				deletable(1, assign(id("x"), id("x"))),
				assign(id("y"), new ReverseToLhsBinop(2, "redundant factor removed", times(id("x"), id("z"))))));
	}

	private String run(boolean expectSuccess, String... args) {
		StringWriter out = new StringWriter();
		assertEquals(expectSuccess, new SFuzzMain(args, out).run());
		return out.toString();
	}

	@Test
	public void printsTree() {
		assertEquals(
				"{\n" +
				"    x = x;\n" +
				"    y = x * z;\n" +
				"}\n",
				run(true, input.getPath()));
	}

	@Test
	public void printsCommentary() {
		assertEquals(
				"{\n" +
				"    /* deletable statement */\n" +
				"    x = x;\n" +
				"    y = /* redundant factor removed */ x * z;\n" +
				"}\n",
				run(true, "--commentary", input.getPath()));
	}

	@Test
	public void reversesAndWritesOutput() throws IOException {
		File output = new File(folder.getRoot(), "output.json");
		assertEquals(
				"{\n" +
				"    y = x;\n" +
				"}\n",
				run(true, "--reverse=1,2", "-o", output.getPath(), input.getPath()));
		assertEquals(block(assign(id("y"), id("x"))), TreeFiles.read(output.toPath()));
	}

	@Test
	public void unknownMutationIdFails() {
		run(false, "--reverse=5", input.getPath());
	}

	@Test
	public void malformedInputFails() throws IOException {
		FileUtils.writeStringToFile(input, "{\"format\": 1, \"root\": {\"kind\": \"goto\"}}", StandardCharsets.UTF_8);
		run(false, input.getPath());
	}

	@Test
	public void missingInputFails() {
		run(false, new File(folder.getRoot(), "absent.json").getPath());
	}
}
