package sfuzz.formatters;

import sfuzz.errors.IssueVisitor;
import sfuzz.model.type.NoCommonTypeIssue;
import sfuzz.options.OptionParserIssue;
import sfuzz.reduce.UnknownMutationIdIssue;

import java.io.IOException;

public class IssueFormattingVisitor extends IssueVisitor<Void, IOException> {
	private final IndentingWriter out;

	public IssueFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	@Override
	public Void visit(NoCommonTypeIssue noCommonTypeIssue) throws IOException {
		if (noCommonTypeIssue.getTypes().isEmpty()) {
			out.write("no common type can be found for an empty list of types");
			return null;
		}
		out.write("no common type found among ");
		FormattingTools.writeCommaSeparated(
				out, noCommonTypeIssue.getTypes(), t -> t.accept(new TypeFormattingVisitor(out)));
		return null;
	}

	@Override
	public Void visit(UnknownMutationIdIssue unknownMutationIdIssue) throws IOException {
		out.write("no augmented node with mutation id ");
		out.write(Integer.toString(unknownMutationIdIssue.getId()));
		out.write(" exists in the tree");
		return null;
	}

	@Override
	public Void visit(OptionParserIssue optionParserIssue) throws IOException {
		out.write("option error: ");
		out.write(optionParserIssue.getDescription());
		return null;
	}
}
