package sfuzz.options;

import sfuzz.SFuzzOptionException;
import sfuzz.SFuzzOptions;
import sfuzz.errors.IssueContext;

import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;

public class OptionParsingPass {
	private OptionParsingPass() {}

	/**
	 * Parses the command line and sets the log level of logger, which should be the "sfuzz" logger so that the
	 * level reaches every "sfuzz.*" logger below it.
	 */
	public static SFuzzOptions perform(IssueContext ctx, Logger logger, String[] args) {
		SFuzzOptions opts = new SFuzzOptions(args);
		try {
			opts.parse();
		} catch (SFuzzOptionException e) {
			ctx.error(new OptionParserIssue(e.getMessage()));
		}
		// set the logger's log level based on command line arguments
		Level level;
		if (opts.logLvlQuiet) {
			level = Level.WARNING;
		} else if (opts.logLvlVerbose) {
			level = Level.FINE;
		} else {
			level = Level.INFO;
		}
		logger.setLevel(level);
		// the default console handler drops anything below INFO
		for (Handler handler : Logger.getLogger("").getHandlers()) {
			handler.setLevel(level);
		}
		return opts;
	}
}
