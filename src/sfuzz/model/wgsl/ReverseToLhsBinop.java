package sfuzz.model.wgsl;

public class ReverseToLhsBinop extends AugmentedBinop {

	public ReverseToLhsBinop(int id, String commentary, Operation op, WgslExpression lhs, WgslExpression rhs) {
		super(id, commentary, op, lhs, rhs);
	}

	public ReverseToLhsBinop(int id, String commentary, WgslBinop binop) {
		this(id, commentary, binop.getOperation(), binop.getLHS(), binop.getRHS());
	}

	@Override
	protected WgslExpression keptOperand(WgslBinop binop) {
		return binop.getLHS();
	}

	@Override
	public <T, E extends Throwable> T accept(WgslExpressionVisitor<T, E> visitor) throws E {
		return visitor.visit(this);
	}
}
