package sfuzz.model.wgsl;

import java.util.Objects;

public class WgslBinop extends WgslExpression {

	private final WgslExpression lhs;
	private final WgslExpression rhs;
	private final Operation op;

	public enum Operation {
		// grouped by precedence
		OR("||"),
		AND("&&"),

		BOR("|"),
		BXOR("^"),
		BAND("&"),

		EQ("=="),
		NEQ("!="),
		LT("<"),
		LEQ("<="),
		GT(">"),
		GEQ(">="),

		LSHIFT("<<"),
		RSHIFT(">>"),

		PLUS("+"),
		MINUS("-"),

		TIMES("*"),
		DIVIDE("/"),
		MOD("%"),
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
			throw new IllegalArgumentException("unknown binary operator \"" + symbol + "\"");
		}
	}

	public WgslBinop(Operation op, WgslExpression lhs, WgslExpression rhs) {
		this.op = op;
		this.lhs = lhs;
		this.rhs = rhs;
	}

	public Operation getOperation() {
		return op;
	}

	public WgslExpression getLHS() {
		return lhs;
	}

	public WgslExpression getRHS() {
		return rhs;
	}

	@Override
	public <T, E extends Throwable> T accept(WgslExpressionVisitor<T, E> visitor) throws E {
		return visitor.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		WgslBinop binop = (WgslBinop) o;
		return Objects.equals(lhs, binop.lhs) &&
				Objects.equals(rhs, binop.rhs) &&
				op == binop.op;
	}

	@Override
	public int hashCode() {

		return Objects.hash(lhs, rhs, op);
	}
}
