package sfuzz.formatters;

import sfuzz.model.wgsl.WgslExpression;
import sfuzz.model.wgsl.WgslNodeVisitor;
import sfuzz.model.wgsl.WgslStatement;

import java.io.IOException;

public class WgslNodeFormattingVisitor extends WgslNodeVisitor<Void, IOException> {

	private final IndentingWriter out;
	private final boolean emitCommentary;

	/**
	 * @param emitCommentary whether augmented nodes should explain themselves in comments; if false the output is
	 *                       that of the tree with no commentary at all
	 */
	public WgslNodeFormattingVisitor(IndentingWriter out, boolean emitCommentary) {
		this.out = out;
		this.emitCommentary = emitCommentary;
	}

	@Override
	public Void visit(WgslExpression expression) throws IOException {
		expression.accept(new WgslExpressionFormattingVisitor(out, emitCommentary));
		return null;
	}

	@Override
	public Void visit(WgslStatement statement) throws IOException {
		statement.accept(new WgslStatementFormattingVisitor(out, emitCommentary));
		return null;
	}
}
