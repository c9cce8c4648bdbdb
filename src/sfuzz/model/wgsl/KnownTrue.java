package sfuzz.model.wgsl;

public class KnownTrue extends KnownBooleanExpression {

	public KnownTrue(int id, String commentary, WgslExpression trueExpression) {
		super(id, commentary, trueExpression);
	}

	@Override
	public boolean getKnownValue() {
		return true;
	}

	@Override
	public <T, E extends Throwable> T accept(WgslExpressionVisitor<T, E> visitor) throws E {
		return visitor.visit(this);
	}
}
