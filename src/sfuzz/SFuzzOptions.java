package sfuzz;

import org.apache.commons.io.FileUtils;
import org.json.JSONException;
import org.json.JSONObject;
import org.plumelib.options.Option;
import org.plumelib.options.Options;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class SFuzzOptions {
	public static final String VERSION = "0.1.0";

	public static final int DEFAULT_INDENT = 4;

	@Option("Print the version and exit")
	public boolean version = false;

	@Option("-h Print usage information")
	public boolean help = false;

	@Option(value = "-q Reduce printing during execution", aliases = { "--quiet" })
	public boolean logLvlQuiet = false;

	/**
	 * Be verbose, print extra detailed information. Sets the log level to FINE.
	 */
	@Option(value = "-v Print detailed information during execution ", aliases = { "--verbose" })
	public boolean logLvlVerbose = false;

	@Option(value = "-c path to the configuration file, if any")
	public String configFilePath;

	@Option(value = "Print mutation commentary alongside the tree")
	public boolean commentary = false;

	@Option(value = "Comma-separated mutation ids to reverse")
	public String reverse;

	@Option(value = "-o path to write the resulting tree to, if any")
	public String outputFilePath;

	public String inputFilePath;

	// fields extracted from the command line and the JSON configuration file
	public boolean emitCommentary = false;
	public int indent = DEFAULT_INDENT;
	public List<Integer> reverseIds = Collections.emptyList();

	private Options plumeOptions;
	private String[] remainingArgs;

	public void printHelp() {
		plumeOptions.printUsage();
	}

	public SFuzzOptions(String[] args) {
		plumeOptions = new Options("sfuzz [options] tree.json", this);
		remainingArgs = plumeOptions.parse(false, args);
	}

	/**
	 * Validates the parsed command line and reads the configuration file, if one was given. Exits the process when
	 * only the version or usage was requested.
	 */
	public void parse() throws SFuzzOptionException {
		if (version) {
			System.out.println("SFuzz version " + VERSION);
			System.exit(0);
		}

		if (help) {
			printHelp();
			System.exit(0);
		}

		if (remainingArgs.length != 1) {
			throw new SFuzzOptionException("Exactly one input tree file is required");
		}

		inputFilePath = remainingArgs[0];

		if (configFilePath != null && !configFilePath.isEmpty()) {
			String s;
			try {
				s = FileUtils.readFileToString(new File(configFilePath), StandardCharsets.UTF_8);
			} catch (IOException ex) {
				throw new SFuzzOptionException("Error reading configuration file: " + ex.getMessage());
			}
			readConfig(s);
		}

		if (commentary) {
			emitCommentary = true;
		}

		if (reverse != null) {
			reverseIds = parseIds(reverse);
		}
	}

	void readConfig(String s) throws SFuzzOptionException {
		JSONObject config;
		try {
			config = new JSONObject(s);
		} catch (JSONException e) {
			throw new SFuzzOptionException(configFilePath + ": parsing error: " + e.getMessage());
		}

		if (!config.has("printer")) {
			return;
		}
		try {
			JSONObject printer = config.getJSONObject("printer");
			if (printer.has("emit_commentary")) {
				emitCommentary = printer.getBoolean("emit_commentary");
			}
			if (printer.has("indent")) {
				indent = printer.getInt("indent");
			}
		} catch (JSONException e) {
			throw new SFuzzOptionException("Configuration is invalid: " + e.getMessage());
		}
		if (indent < 0) {
			throw new SFuzzOptionException("Indentation must not be negative");
		}
	}

	static List<Integer> parseIds(String ids) throws SFuzzOptionException {
		List<Integer> result = new ArrayList<>();
		for (String part : ids.split(",")) {
			String trimmed = part.trim();
			if (trimmed.isEmpty()) {
				continue;
			}
			try {
				result.add(Integer.parseInt(trimmed));
			} catch (NumberFormatException e) {
				throw new SFuzzOptionException("Invalid mutation id \"" + trimmed + "\"");
			}
		}
		return result;
	}
}
