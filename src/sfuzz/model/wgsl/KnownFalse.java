package sfuzz.model.wgsl;

public class KnownFalse extends KnownBooleanExpression {

	public KnownFalse(int id, String commentary, WgslExpression falseExpression) {
		super(id, commentary, falseExpression);
	}

	@Override
	public boolean getKnownValue() {
		return false;
	}

	@Override
	public <T, E extends Throwable> T accept(WgslExpressionVisitor<T, E> visitor) throws E {
		return visitor.visit(this);
	}
}
