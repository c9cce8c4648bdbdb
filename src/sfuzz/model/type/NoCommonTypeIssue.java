package sfuzz.model.type;

import sfuzz.errors.Issue;
import sfuzz.errors.IssueVisitor;

import java.util.List;

public class NoCommonTypeIssue extends Issue {
	private final List<Type> types;

	public NoCommonTypeIssue(List<Type> types) {
		this.types = types;
	}

	public List<Type> getTypes() {
		return types;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
