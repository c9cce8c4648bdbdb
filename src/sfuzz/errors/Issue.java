package sfuzz.errors;

import sfuzz.AnalysisException;
import sfuzz.Unreachable;
import sfuzz.formatters.IndentingWriter;
import sfuzz.formatters.IssueFormattingVisitor;

import java.io.IOException;
import java.io.StringWriter;

public abstract class Issue extends AnalysisException {
	public Issue() {
		super("");
	}

	public Issue(String msg) {
		super(msg);
	}

	@Override
	public String getMessage() {
		StringWriter sw = new StringWriter();
		IndentingWriter out = new IndentingWriter(sw);
		try {
			accept(new IssueFormattingVisitor(out));
		} catch (IOException e) {
			throw new Unreachable(); // string ops don't throw IO exceptions
		}
		return sw.getBuffer().toString();
	}

	public abstract <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E;

}
