package sfuzz.formatters;

import sfuzz.model.wgsl.*;

import java.io.IOException;

public class WgslExpressionFormattingVisitor extends WgslExpressionVisitor<Void, IOException> {

	private final IndentingWriter out;
	private final boolean emitCommentary;

	public WgslExpressionFormattingVisitor(IndentingWriter out, boolean emitCommentary) {
		this.out = out;
		this.emitCommentary = emitCommentary;
	}

	private void commentary(AugmentedNode node) throws IOException {
		if (emitCommentary) {
			node.emitCommentary(new IndentingCommentarySink(out));
		}
	}

	@Override
	public Void visit(WgslIdentifier identifier) throws IOException {
		out.write(identifier.getName());
		return null;
	}

	@Override
	public Void visit(WgslBoolLiteral boolLiteral) throws IOException {
		out.write(boolLiteral.getValue() ? "true" : "false");
		return null;
	}

	@Override
	public Void visit(WgslIntLiteral intLiteral) throws IOException {
		out.write(intLiteral.getText());
		return null;
	}

	@Override
	public Void visit(WgslFloatLiteral floatLiteral) throws IOException {
		out.write(floatLiteral.getText());
		return null;
	}

	@Override
	public Void visit(WgslParen paren) throws IOException {
		out.write("(");
		paren.getTarget().accept(this);
		out.write(")");
		return null;
	}

	@Override
	public Void visit(WgslUnary unary) throws IOException {
		out.write(unary.getOperation().getSymbol());
		unary.getOperand().accept(this);
		return null;
	}

	@Override
	public Void visit(WgslBinop binop) throws IOException {
		binop.getLHS().accept(this);
		out.write(" ");
		out.write(binop.getOperation().getSymbol());
		out.write(" ");
		binop.getRHS().accept(this);
		return null;
	}

	@Override
	public Void visit(AddedParen addedParen) throws IOException {
		commentary(addedParen);
		return visit((WgslParen) addedParen);
	}

	@Override
	public Void visit(ReverseToLhsBinop reverseToLhsBinop) throws IOException {
		commentary(reverseToLhsBinop);
		return visit((WgslBinop) reverseToLhsBinop);
	}

	@Override
	public Void visit(ReverseToRhsBinop reverseToRhsBinop) throws IOException {
		commentary(reverseToRhsBinop);
		return visit((WgslBinop) reverseToRhsBinop);
	}

	@Override
	public Void visit(KnownFalse knownFalse) throws IOException {
		commentary(knownFalse);
		knownFalse.getExpression().accept(this);
		return null;
	}

	@Override
	public Void visit(KnownTrue knownTrue) throws IOException {
		commentary(knownTrue);
		knownTrue.getExpression().accept(this);
		return null;
	}
}
