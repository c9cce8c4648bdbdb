package sfuzz.serialization;

import org.json.JSONArray;
import org.json.JSONObject;
import sfuzz.model.wgsl.*;

import java.util.List;

/**
 * Converts trees into tagged JSON objects. Augmented nodes keep their mutation id and commentary, so a decoded tree can
 * still be reduced.
 */
public class WgslJsonEncoder {
	private WgslJsonEncoder() {}

	public static JSONObject encode(WgslNode node) {
		return node.accept(new WgslNodeVisitor<JSONObject, RuntimeException>() {
			@Override
			public JSONObject visit(WgslExpression expression) {
				return encode(expression);
			}

			@Override
			public JSONObject visit(WgslStatement statement) {
				return encode(statement);
			}
		});
	}

	public static JSONObject encode(WgslExpression expression) {
		return expression.accept(new ExpressionEncoder());
	}

	public static JSONObject encode(WgslStatement statement) {
		return statement.accept(new StatementEncoder());
	}

	private static JSONObject tagged(String kind) {
		JSONObject result = new JSONObject();
		result.put("kind", kind);
		return result;
	}

	private static JSONObject augmented(String kind, AugmentedNode node) {
		JSONObject result = tagged(kind);
		result.put("id", node.getId());
		if (node.getCommentary() != null) {
			result.put("commentary", node.getCommentary());
		}
		return result;
	}

	private static JSONArray encodeAll(List<WgslStatement> statements) {
		JSONArray result = new JSONArray();
		for (WgslStatement statement : statements) {
			result.put(encode(statement));
		}
		return result;
	}

	private static class ExpressionEncoder extends WgslExpressionVisitor<JSONObject, RuntimeException> {
		private JSONObject binop(JSONObject result, WgslBinop binop) {
			result.put("operator", binop.getOperation().getSymbol());
			result.put("lhs", binop.getLHS().accept(this));
			result.put("rhs", binop.getRHS().accept(this));
			return result;
		}

		@Override
		public JSONObject visit(WgslIdentifier identifier) {
			JSONObject result = tagged("identifier");
			result.put("name", identifier.getName());
			return result;
		}

		@Override
		public JSONObject visit(WgslBoolLiteral boolLiteral) {
			JSONObject result = tagged("bool_literal");
			result.put("value", boolLiteral.getValue());
			return result;
		}

		@Override
		public JSONObject visit(WgslIntLiteral intLiteral) {
			JSONObject result = tagged("int_literal");
			result.put("text", intLiteral.getText());
			return result;
		}

		@Override
		public JSONObject visit(WgslFloatLiteral floatLiteral) {
			JSONObject result = tagged("float_literal");
			result.put("text", floatLiteral.getText());
			return result;
		}

		@Override
		public JSONObject visit(WgslParen paren) {
			JSONObject result = tagged("paren");
			result.put("target", paren.getTarget().accept(this));
			return result;
		}

		@Override
		public JSONObject visit(WgslUnary unary) {
			JSONObject result = tagged("unary");
			result.put("operator", unary.getOperation().getSymbol());
			result.put("operand", unary.getOperand().accept(this));
			return result;
		}

		@Override
		public JSONObject visit(WgslBinop binop) {
			return binop(tagged("binary"), binop);
		}

		@Override
		public JSONObject visit(AddedParen addedParen) {
			JSONObject result = augmented("added_paren", addedParen);
			result.put("target", addedParen.getTarget().accept(this));
			return result;
		}

		@Override
		public JSONObject visit(ReverseToLhsBinop reverseToLhsBinop) {
			return binop(augmented("reverse_to_lhs_binary", reverseToLhsBinop), reverseToLhsBinop);
		}

		@Override
		public JSONObject visit(ReverseToRhsBinop reverseToRhsBinop) {
			return binop(augmented("reverse_to_rhs_binary", reverseToRhsBinop), reverseToRhsBinop);
		}

		@Override
		public JSONObject visit(KnownFalse knownFalse) {
			JSONObject result = augmented("known_false", knownFalse);
			result.put("expression", knownFalse.getExpression().accept(this));
			return result;
		}

		@Override
		public JSONObject visit(KnownTrue knownTrue) {
			JSONObject result = augmented("known_true", knownTrue);
			result.put("expression", knownTrue.getExpression().accept(this));
			return result;
		}
	}

	private static class StatementEncoder extends WgslStatementVisitor<JSONObject, RuntimeException> {
		private final ExpressionEncoder expressions = new ExpressionEncoder();

		@Override
		public JSONObject visit(WgslCompound compound) {
			JSONObject result = tagged("compound");
			result.put("statements", encodeAll(compound.getStatements()));
			return result;
		}

		@Override
		public JSONObject visit(WgslIf wgslIf) {
			JSONObject result = tagged("if");
			result.put("condition", wgslIf.getCond().accept(expressions));
			result.put("then", wgslIf.getThen().accept(this));
			if (wgslIf.getElse() != null) {
				result.put("else", wgslIf.getElse().accept(this));
			}
			return result;
		}

		@Override
		public JSONObject visit(WgslWhile wgslWhile) {
			JSONObject result = tagged("while");
			result.put("condition", wgslWhile.getCond().accept(expressions));
			result.put("body", wgslWhile.getBody().accept(this));
			return result;
		}

		@Override
		public JSONObject visit(WgslAssignment assignment) {
			JSONObject result = tagged("assignment");
			result.put("lhs", assignment.getLHS().accept(expressions));
			result.put("rhs", assignment.getRHS().accept(expressions));
			return result;
		}

		@Override
		public JSONObject visit(WgslReturn wgslReturn) {
			JSONObject result = tagged("return");
			if (wgslReturn.getValue() != null) {
				result.put("value", wgslReturn.getValue().accept(expressions));
			}
			return result;
		}

		@Override
		public JSONObject visit(WgslBreak break1) {
			return tagged("break");
		}

		@Override
		public JSONObject visit(WgslContinue continue1) {
			return tagged("continue");
		}

		@Override
		public JSONObject visit(WgslDiscard discard) {
			return tagged("discard");
		}

		@Override
		public JSONObject visit(DeletableStatement deletableStatement) {
			JSONObject result = augmented("deletable_statement", deletableStatement);
			result.put("statement", deletableStatement.getStatement().accept(this));
			return result;
		}

		@Override
		public JSONObject visit(EmptiableCompound emptiableCompound) {
			JSONObject result = augmented("emptiable_compound", emptiableCompound);
			result.put("statements", encodeAll(emptiableCompound.getStatements()));
			return result;
		}

		@Override
		public JSONObject visit(DeadCodeFragment deadCodeFragment) {
			JSONObject result = augmented("dead_code_fragment", deadCodeFragment);
			result.put("statement", deadCodeFragment.getStatement().accept(this));
			return result;
		}

		@Override
		public JSONObject visit(ControlFlowWrapper controlFlowWrapper) {
			JSONObject result = augmented("control_flow_wrapper", controlFlowWrapper);
			result.put("statement", controlFlowWrapper.getStatement().accept(this));
			return result;
		}

		@Override
		public JSONObject visit(WrappedOriginalStatements wrappedOriginalStatements) {
			JSONObject result = augmented("wrapped_original_statements", wrappedOriginalStatements);
			result.put("statements", encodeAll(wrappedOriginalStatements.getStatements()));
			return result;
		}
	}
}
