package sfuzz;

import sfuzz.errors.TopLevelIssueContext;
import sfuzz.formatters.IndentingWriter;
import sfuzz.formatters.WgslNodeFormattingVisitor;
import sfuzz.model.wgsl.WgslCompound;
import sfuzz.model.wgsl.WgslNode;
import sfuzz.options.OptionParsingPass;
import sfuzz.reduce.AugmentedNodeCollector;
import sfuzz.reduce.MutationReverser;
import sfuzz.serialization.TreeFiles;

import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.Optional;
import java.util.logging.Logger;

public class SFuzzMain {
	private final String[] cmdArgs;
	private final Writer stdout;
	private static Logger logger;

	public SFuzzMain(String[] args) {
		this(args, new OutputStreamWriter(System.out, StandardCharsets.UTF_8));
	}

	SFuzzMain(String[] args, Writer stdout) {
		cmdArgs = args;
		this.stdout = stdout;
		// Get the top Logger instance
		logger = Logger.getLogger("sfuzz");
	}

	public static void main(String[] args) {
		if (new SFuzzMain(args).run()) {
			logger.info("Finished");
		} else {
			logger.info("Terminated with errors");
			System.exit(1);
		}
	}

	WgslNode reversePipeline(TopLevelIssueContext ctx, SFuzzOptions opts, WgslNode root) {
		AugmentedNodeCollector collector = new AugmentedNodeCollector(root);
		logger.info("Tree contains " + collector.getIds().size() + " mutation(s)");
		if (opts.reverseIds.isEmpty()) {
			return root;
		}

		logger.info("Checking requested mutation ids");
		collector.checkIdsPresent(ctx, opts.reverseIds);
		checkErrors(ctx);

		logger.info("Reversing " + opts.reverseIds.size() + " mutation(s)");
		Optional<WgslNode> result = new MutationReverser(opts.reverseIds).reverse(root);
		if (!result.isPresent()) {
			logger.warning("Every statement of the tree was deleted");
			return new WgslCompound(Collections.emptyList());
		}
		return result.get();
	}

	// Top-level workhorse method.
	public boolean run() {
		try {
			TopLevelIssueContext ctx = new TopLevelIssueContext();

			// Check options, set up logging.
			SFuzzOptions opts = OptionParsingPass.perform(ctx, logger, cmdArgs);
			if (ctx.hasErrors()) {
				System.err.println(ctx.format());
				opts.printHelp();
				return false;
			}

			logger.info("Reading tree file");
			WgslNode root = TreeFiles.read(Paths.get(opts.inputFilePath));

			WgslNode result = reversePipeline(ctx, opts, root);

			if (opts.outputFilePath != null) {
				Path outputFilePath = Paths.get(opts.outputFilePath);
				logger.info("Writing tree to \"" + outputFilePath + "\"");
				TreeFiles.write(outputFilePath, result);
			}

			logger.info("Printing tree");
			IndentingWriter out = new IndentingWriter(stdout, opts.indent);
			result.accept(new WgslNodeFormattingVisitor(out, opts.emitCommentary));
			out.newLine();
			out.flush();
		} catch (SFuzzException | InternalFuzzerError | IOException e) {
			logger.severe("found issues");
			logger.severe(e.getMessage());
			return false;
		}

		return true;
	}

	private static void checkErrors(TopLevelIssueContext ctx) {
		if (ctx.hasErrors()) {
			throw new AnalysisException(ctx.format());
		}
	}
}
