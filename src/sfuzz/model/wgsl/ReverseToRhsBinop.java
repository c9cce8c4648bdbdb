package sfuzz.model.wgsl;

public class ReverseToRhsBinop extends AugmentedBinop {

	public ReverseToRhsBinop(int id, String commentary, Operation op, WgslExpression lhs, WgslExpression rhs) {
		super(id, commentary, op, lhs, rhs);
	}

	public ReverseToRhsBinop(int id, String commentary, WgslBinop binop) {
		this(id, commentary, binop.getOperation(), binop.getLHS(), binop.getRHS());
	}

	@Override
	protected WgslExpression keptOperand(WgslBinop binop) {
		return binop.getRHS();
	}

	@Override
	public <T, E extends Throwable> T accept(WgslExpressionVisitor<T, E> visitor) throws E {
		return visitor.visit(this);
	}
}
