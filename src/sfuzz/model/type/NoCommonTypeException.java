package sfuzz.model.type;

/**
 * Thrown when a list of types has no common concretization. Callers checking whether a mutation applies should treat
 * this as "not applicable".
 */
public class NoCommonTypeException extends Exception {
	private static final long serialVersionUID = 2931577420468108311L;

	private final NoCommonTypeIssue issue;

	NoCommonTypeException(NoCommonTypeIssue issue) {
		super(issue.getMessage());
		this.issue = issue;
	}

	public NoCommonTypeIssue getIssue() {
		return issue;
	}
}
