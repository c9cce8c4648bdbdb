package sfuzz.options;

import org.junit.After;
import org.junit.Test;
import sfuzz.errors.TopLevelIssueContext;

import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;

import static org.junit.Assert.*;

public class OptionParsingPassTest {

	private final Logger logger = Logger.getLogger("sfuzz");

	@After
	public void resetLevel() {
		logger.setLevel(Level.INFO);
		for (Handler handler : Logger.getLogger("").getHandlers()) {
			handler.setLevel(Level.INFO);
		}
	}

	@Test
	public void verboseReachesPackageLoggers() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		OptionParsingPass.perform(ctx, logger, new String[]{ "-v", "tree.json" });
		assertFalse(ctx.hasErrors());
		assertTrue(Logger.getLogger("sfuzz.reduce").isLoggable(Level.FINE));
		assertTrue(Logger.getLogger("sfuzz.serialization").isLoggable(Level.FINE));
		for (Handler handler : Logger.getLogger("").getHandlers()) {
			assertEquals(Level.FINE, handler.getLevel());
		}
	}

	@Test
	public void quietSilencesPackageLoggers() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		OptionParsingPass.perform(ctx, logger, new String[]{ "-q", "tree.json" });
		assertFalse(Logger.getLogger("sfuzz.reduce").isLoggable(Level.INFO));
		assertTrue(Logger.getLogger("sfuzz.reduce").isLoggable(Level.WARNING));
	}

	@Test
	public void missingInputIsReportedAsIssue() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		OptionParsingPass.perform(ctx, logger, new String[0]);
		assertTrue(ctx.hasErrors());
		assertTrue(Logger.getLogger("sfuzz.reduce").isLoggable(Level.INFO));
	}
}
