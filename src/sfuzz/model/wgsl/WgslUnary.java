package sfuzz.model.wgsl;

import java.util.Objects;

public class WgslUnary extends WgslExpression {

	private final Operation op;
	private final WgslExpression operand;

	public enum Operation {
		NEGATE("-"),
		NOT("!"),
		COMPLEMENT("~"),
		;

		private final String symbol;

		Operation(String symbol) {
			this.symbol = symbol;
		}

		public String getSymbol() {
			return symbol;
		}

		public static Operation fromSymbol(String symbol) {
			for (Operation op : values()) {
				if (op.symbol.equals(symbol)) {
					return op;
				}
			}
			throw new IllegalArgumentException("unknown unary operator \"" + symbol + "\"");
		}
	}

	public WgslUnary(Operation op, WgslExpression operand) {
		this.op = op;
		this.operand = operand;
	}

	public Operation getOperation() {
		return op;
	}

	public WgslExpression getOperand() {
		return operand;
	}

	@Override
	public <T, E extends Throwable> T accept(WgslExpressionVisitor<T, E> visitor) throws E {
		return visitor.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		WgslUnary unary = (WgslUnary) o;
		return op == unary.op && Objects.equals(operand, unary.operand);
	}

	@Override
	public int hashCode() {
		return Objects.hash(op, operand);
	}
}
