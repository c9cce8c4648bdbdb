package sfuzz.serialization;

import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import sfuzz.model.wgsl.*;

import java.util.ArrayList;
import java.util.List;

/**
 * Rebuilds trees from the tagged JSON produced by {@link WgslJsonEncoder}. Nodes are reconstructed through their
 * constructors, so decoding a dead code fragment around an unsupported statement fails the same way building one does.
 */
public class WgslJsonDecoder {
	private WgslJsonDecoder() {}

	public static WgslNode decodeNode(JSONObject json) {
		try {
			String kind = json.getString("kind");
			if (isStatementKind(kind)) {
				return statement(json);
			}
			return expression(json);
		} catch (JSONException e) {
			throw new MalformedTreeException(e.getMessage(), e);
		}
	}

	public static WgslExpression decodeExpression(JSONObject json) {
		try {
			return expression(json);
		} catch (JSONException e) {
			throw new MalformedTreeException(e.getMessage(), e);
		}
	}

	public static WgslStatement decodeStatement(JSONObject json) {
		try {
			return statement(json);
		} catch (JSONException e) {
			throw new MalformedTreeException(e.getMessage(), e);
		}
	}

	private static boolean isStatementKind(String kind) {
		switch (kind) {
			case "compound":
			case "if":
			case "while":
			case "assignment":
			case "return":
			case "break":
			case "continue":
			case "discard":
			case "deletable_statement":
			case "emptiable_compound":
			case "dead_code_fragment":
			case "control_flow_wrapper":
			case "wrapped_original_statements":
				return true;
			default:
				return false;
		}
	}

	private static String commentary(JSONObject json) {
		if (!json.has("commentary") || json.isNull("commentary")) {
			return null;
		}
		return json.getString("commentary");
	}

	private static WgslBinop.Operation binaryOperator(JSONObject json) {
		try {
			return WgslBinop.Operation.fromSymbol(json.getString("operator"));
		} catch (IllegalArgumentException e) {
			throw new MalformedTreeException(e.getMessage(), e);
		}
	}

	private static WgslExpression expression(JSONObject json) {
		String kind = json.getString("kind");
		switch (kind) {
			case "identifier":
				return new WgslIdentifier(json.getString("name"));
			case "bool_literal":
				return new WgslBoolLiteral(json.getBoolean("value"));
			case "int_literal":
				return new WgslIntLiteral(json.getString("text"));
			case "float_literal":
				return new WgslFloatLiteral(json.getString("text"));
			case "paren":
				return new WgslParen(expression(json.getJSONObject("target")));
			case "unary":
				try {
					return new WgslUnary(
							WgslUnary.Operation.fromSymbol(json.getString("operator")),
							expression(json.getJSONObject("operand")));
				} catch (IllegalArgumentException e) {
					throw new MalformedTreeException(e.getMessage(), e);
				}
			case "binary":
				return new WgslBinop(
						binaryOperator(json),
						expression(json.getJSONObject("lhs")),
						expression(json.getJSONObject("rhs")));
			case "added_paren":
				return new AddedParen(json.getInt("id"), commentary(json), expression(json.getJSONObject("target")));
			case "reverse_to_lhs_binary":
				return new ReverseToLhsBinop(
						json.getInt("id"),
						commentary(json),
						binaryOperator(json),
						expression(json.getJSONObject("lhs")),
						expression(json.getJSONObject("rhs")));
			case "reverse_to_rhs_binary":
				return new ReverseToRhsBinop(
						json.getInt("id"),
						commentary(json),
						binaryOperator(json),
						expression(json.getJSONObject("lhs")),
						expression(json.getJSONObject("rhs")));
			case "known_false":
				return new KnownFalse(json.getInt("id"), commentary(json), expression(json.getJSONObject("expression")));
			case "known_true":
				return new KnownTrue(json.getInt("id"), commentary(json), expression(json.getJSONObject("expression")));
			default:
				throw new MalformedTreeException("unknown expression kind \"" + kind + "\"");
		}
	}

	private static List<WgslStatement> statements(JSONArray array) {
		List<WgslStatement> result = new ArrayList<>(array.length());
		for (int i = 0; i < array.length(); i++) {
			result.add(statement(array.getJSONObject(i)));
		}
		return result;
	}

	private static WgslCompound compound(JSONObject json) {
		WgslStatement result = statement(json);
		if (!(result instanceof WgslCompound)) {
			throw new MalformedTreeException("expected a compound statement, got \"" + json.getString("kind") + "\"");
		}
		return (WgslCompound) result;
	}

	private static WgslStatement statement(JSONObject json) {
		String kind = json.getString("kind");
		switch (kind) {
			case "compound":
				return new WgslCompound(statements(json.getJSONArray("statements")));
			case "if": {
				WgslStatement bElse = null;
				if (json.has("else")) {
					bElse = statement(json.getJSONObject("else"));
				}
				return new WgslIf(expression(json.getJSONObject("condition")), compound(json.getJSONObject("then")), bElse);
			}
			case "while":
				return new WgslWhile(expression(json.getJSONObject("condition")), compound(json.getJSONObject("body")));
			case "assignment":
				return new WgslAssignment(expression(json.getJSONObject("lhs")), expression(json.getJSONObject("rhs")));
			case "return": {
				WgslExpression value = null;
				if (json.has("value")) {
					value = expression(json.getJSONObject("value"));
				}
				return new WgslReturn(value);
			}
			case "break":
				return new WgslBreak();
			case "continue":
				return new WgslContinue();
			case "discard":
				return new WgslDiscard();
			case "deletable_statement":
				return new DeletableStatement(json.getInt("id"), commentary(json), statement(json.getJSONObject("statement")));
			case "emptiable_compound":
				return new EmptiableCompound(json.getInt("id"), commentary(json), statements(json.getJSONArray("statements")));
			case "dead_code_fragment":
				return new DeadCodeFragment(json.getInt("id"), commentary(json), statement(json.getJSONObject("statement")));
			case "control_flow_wrapper":
				return new ControlFlowWrapper(json.getInt("id"), commentary(json), statement(json.getJSONObject("statement")));
			case "wrapped_original_statements":
				return new WrappedOriginalStatements(
						json.getInt("id"), commentary(json), statements(json.getJSONArray("statements")));
			default:
				throw new MalformedTreeException("unknown statement kind \"" + kind + "\"");
		}
	}
}
