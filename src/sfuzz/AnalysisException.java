package sfuzz;

/**
 * Exception raised while reasoning about a tree or its types
 *
 */
public class AnalysisException extends SFuzzException {

	private static final long serialVersionUID = 4127730917334785021L;
	private static final String prefix = "Analysis Error";

	public AnalysisException(String msg) {
		super(prefix, msg);
	}

}
