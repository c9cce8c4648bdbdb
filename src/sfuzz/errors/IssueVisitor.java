package sfuzz.errors;

import sfuzz.model.type.NoCommonTypeIssue;
import sfuzz.options.OptionParserIssue;
import sfuzz.reduce.UnknownMutationIdIssue;

public abstract class IssueVisitor<T, E extends Throwable> {
	public abstract T visit(NoCommonTypeIssue noCommonTypeIssue) throws E;
	public abstract T visit(UnknownMutationIdIssue unknownMutationIdIssue) throws E;
	public abstract T visit(OptionParserIssue optionParserIssue) throws E;
}
