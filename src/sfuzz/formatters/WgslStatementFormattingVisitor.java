package sfuzz.formatters;

import sfuzz.model.wgsl.*;

import java.io.IOException;

/**
 * Prints statements. A statement leaves the writer at the end of its last line; compounds put each of their
 * statements on its own line.
 */
public class WgslStatementFormattingVisitor extends WgslStatementVisitor<Void, IOException> {

	private final IndentingWriter out;
	private final boolean emitCommentary;

	public WgslStatementFormattingVisitor(IndentingWriter out, boolean emitCommentary) {
		this.out = out;
		this.emitCommentary = emitCommentary;
	}

	private WgslExpressionFormattingVisitor expressions() {
		return new WgslExpressionFormattingVisitor(out, emitCommentary);
	}

	private void commentary(AugmentedNode node) throws IOException {
		if (emitCommentary) {
			node.emitCommentary(new IndentingCommentarySink(out));
		}
	}

	@Override
	public Void visit(WgslCompound compound) throws IOException {
		out.write("{");
		out.newLine();
		try (IndentingWriter.Indent ignored = out.indent()) {
			for (WgslStatement stmt : compound.getStatements()) {
				stmt.accept(this);
				out.newLine();
			}
		}
		out.write("}");
		return null;
	}

	@Override
	public Void visit(WgslIf wgslIf) throws IOException {
		out.write("if ");
		wgslIf.getCond().accept(expressions());
		out.write(" ");
		wgslIf.getThen().accept(this);
		if (wgslIf.getElse() != null) {
			out.write(" else ");
			wgslIf.getElse().accept(this);
		}
		return null;
	}

	@Override
	public Void visit(WgslWhile wgslWhile) throws IOException {
		out.write("while ");
		wgslWhile.getCond().accept(expressions());
		out.write(" ");
		wgslWhile.getBody().accept(this);
		return null;
	}

	@Override
	public Void visit(WgslAssignment assignment) throws IOException {
		assignment.getLHS().accept(expressions());
		out.write(" = ");
		assignment.getRHS().accept(expressions());
		out.write(";");
		return null;
	}

	@Override
	public Void visit(WgslReturn wgslReturn) throws IOException {
		out.write("return");
		if (wgslReturn.getValue() != null) {
			out.write(" ");
			wgslReturn.getValue().accept(expressions());
		}
		out.write(";");
		return null;
	}

	@Override
	public Void visit(WgslBreak break1) throws IOException {
		out.write("break;");
		return null;
	}

	@Override
	public Void visit(WgslContinue continue1) throws IOException {
		out.write("continue;");
		return null;
	}

	@Override
	public Void visit(WgslDiscard discard) throws IOException {
		out.write("discard;");
		return null;
	}

	@Override
	public Void visit(DeletableStatement deletableStatement) throws IOException {
		commentary(deletableStatement);
		deletableStatement.getStatement().accept(this);
		return null;
	}

	@Override
	public Void visit(EmptiableCompound emptiableCompound) throws IOException {
		commentary(emptiableCompound);
		return visit((WgslCompound) emptiableCompound);
	}

	@Override
	public Void visit(DeadCodeFragment deadCodeFragment) throws IOException {
		commentary(deadCodeFragment);
		deadCodeFragment.getStatement().accept(this);
		return null;
	}

	@Override
	public Void visit(ControlFlowWrapper controlFlowWrapper) throws IOException {
		commentary(controlFlowWrapper);
		controlFlowWrapper.getStatement().accept(this);
		return null;
	}

	@Override
	public Void visit(WrappedOriginalStatements wrappedOriginalStatements) throws IOException {
		commentary(wrappedOriginalStatements);
		return visit((WgslCompound) wrappedOriginalStatements);
	}
}
