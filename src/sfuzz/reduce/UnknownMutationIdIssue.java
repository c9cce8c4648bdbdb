package sfuzz.reduce;

import sfuzz.errors.Issue;
import sfuzz.errors.IssueVisitor;

public class UnknownMutationIdIssue extends Issue {
	private final int id;

	public UnknownMutationIdIssue(int id) {
		this.id = id;
	}

	public int getId() {
		return id;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
