package sfuzz;

import org.apache.commons.io.FileUtils;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;

import static org.junit.Assert.*;

public class SFuzzOptionsTest {

	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	private static SFuzzOptions options(String... args) throws SFuzzOptionException {
		SFuzzOptions opts = new SFuzzOptions(args);
		opts.parse();
		return opts;
	}

	@Test
	public void defaults() throws SFuzzOptionException {
		SFuzzOptions opts = options("tree.json");
		assertEquals("tree.json", opts.inputFilePath);
		assertFalse(opts.emitCommentary);
		assertEquals(SFuzzOptions.DEFAULT_INDENT, opts.indent);
		assertEquals(Collections.emptyList(), opts.reverseIds);
		assertNull(opts.outputFilePath);
	}

	@Test
	public void reverseAndCommentary() throws SFuzzOptionException {
		SFuzzOptions opts = options("--commentary", "--reverse=3, 1,7", "tree.json");
		assertTrue(opts.emitCommentary);
		assertEquals(Arrays.asList(3, 1, 7), opts.reverseIds);
	}

	@Test(expected = SFuzzOptionException.class)
	public void inputIsRequired() throws SFuzzOptionException {
		options();
	}

	@Test(expected = SFuzzOptionException.class)
	public void badMutationId() throws SFuzzOptionException {
		SFuzzOptions.parseIds("1,two");
	}

	@Test
	public void configFile() throws IOException, SFuzzOptionException {
		File config = folder.newFile("config.json");
		FileUtils.writeStringToFile(
				config, "{\"printer\": {\"emit_commentary\": true, \"indent\": 2}}", StandardCharsets.UTF_8);
		SFuzzOptions opts = options("-c", config.getPath(), "tree.json");
		assertTrue(opts.emitCommentary);
		assertEquals(2, opts.indent);
	}

	@Test
	public void configWithoutPrinterSection() throws SFuzzOptionException {
		SFuzzOptions opts = options("tree.json");
		opts.readConfig("{}");
		assertFalse(opts.emitCommentary);
		assertEquals(SFuzzOptions.DEFAULT_INDENT, opts.indent);
	}

	@Test(expected = SFuzzOptionException.class)
	public void malformedConfig() throws SFuzzOptionException {
		options("tree.json").readConfig("{\"printer\": ");
	}

	@Test(expected = SFuzzOptionException.class)
	public void wrongConfigFieldType() throws SFuzzOptionException {
		options("tree.json").readConfig("{\"printer\": {\"indent\": \"wide\"}}");
	}

	@Test(expected = SFuzzOptionException.class)
	public void missingConfigFile() throws SFuzzOptionException {
		options("-c", new File(folder.getRoot(), "absent.json").getPath(), "tree.json");
	}
}
