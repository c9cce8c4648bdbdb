package sfuzz.model.wgsl;

import java.util.Arrays;

/**
 * Shorthand constructors for building trees in tests.
 */
public class WgslBuilder {
	private WgslBuilder() {}

	public static WgslIdentifier id(String name) {
		return new WgslIdentifier(name);
	}

	public static WgslBoolLiteral bool(boolean value) {
		return new WgslBoolLiteral(value);
	}

	public static WgslIntLiteral num(String text) {
		return new WgslIntLiteral(text);
	}

	public static WgslFloatLiteral flt(String text) {
		return new WgslFloatLiteral(text);
	}

	public static WgslParen paren(WgslExpression target) {
		return new WgslParen(target);
	}

	public static WgslUnary not(WgslExpression operand) {
		return new WgslUnary(WgslUnary.Operation.NOT, operand);
	}

	public static WgslBinop binop(WgslBinop.Operation op, WgslExpression lhs, WgslExpression rhs) {
		return new WgslBinop(op, lhs, rhs);
	}

	public static WgslBinop plus(WgslExpression lhs, WgslExpression rhs) {
		return binop(WgslBinop.Operation.PLUS, lhs, rhs);
	}

	public static WgslBinop times(WgslExpression lhs, WgslExpression rhs) {
		return binop(WgslBinop.Operation.TIMES, lhs, rhs);
	}

	public static WgslCompound block(WgslStatement... statements) {
		return new WgslCompound(Arrays.asList(statements));
	}

	public static WgslIf ifS(WgslExpression cond, WgslCompound bThen) {
		return new WgslIf(cond, bThen, null);
	}

	public static WgslIf ifS(WgslExpression cond, WgslCompound bThen, WgslStatement bElse) {
		return new WgslIf(cond, bThen, bElse);
	}

	public static WgslWhile whileS(WgslExpression cond, WgslCompound body) {
		return new WgslWhile(cond, body);
	}

	public static WgslAssignment assign(WgslExpression lhs, WgslExpression rhs) {
		return new WgslAssignment(lhs, rhs);
	}

	public static WgslReturn ret(WgslExpression value) {
		return new WgslReturn(value);
	}

	public static WgslReturn ret() {
		return new WgslReturn(null);
	}

	public static KnownFalse knownFalse(int id, WgslExpression expression) {
		return new KnownFalse(id, null, expression);
	}

	public static KnownTrue knownTrue(int id, WgslExpression expression) {
		return new KnownTrue(id, null, expression);
	}

	public static DeletableStatement deletable(int id, WgslStatement statement) {
		return new DeletableStatement(id, null, statement);
	}

	public static EmptiableCompound emptiable(int id, WgslStatement... statements) {
		return new EmptiableCompound(id, null, Arrays.asList(statements));
	}

	public static WrappedOriginalStatements wrapped(int id, WgslStatement... statements) {
		return new WrappedOriginalStatements(id, null, Arrays.asList(statements));
	}

	/**
	 * @return {@code if (<known true>) { <original statements> }} wrapped as a control flow mutation with the given id
	 */
	public static ControlFlowWrapper ifTrueWrapper(int id, WgslStatement... statements) {
		return new ControlFlowWrapper(id, null, ifS(knownTrue(id, bool(true)), wrapped(id, statements)));
	}
}
