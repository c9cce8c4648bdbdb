package sfuzz.model.wgsl;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

public final class WgslASTUtil {

	private WgslASTUtil() {}

	private static final WgslNodeVisitor<List<WgslNode>, RuntimeException> CHILDREN =
			new WgslNodeVisitor<List<WgslNode>, RuntimeException>() {
				@Override
				public List<WgslNode> visit(WgslExpression expression) throws RuntimeException {
					return expression.accept(new ExpressionChildren());
				}

				@Override
				public List<WgslNode> visit(WgslStatement statement) throws RuntimeException {
					return statement.accept(new StatementChildren());
				}
			};

	/**
	 * @return the direct children of node, in source order
	 */
	public static List<WgslNode> children(WgslNode node) {
		return node.accept(CHILDREN);
	}

	/**
	 * @return node and all of its descendants, parents before children
	 */
	public static List<WgslNode> nodesPreOrder(WgslNode root) {
		List<WgslNode> result = new ArrayList<>();
		Deque<WgslNode> stack = new ArrayDeque<>();
		stack.push(root);
		while (!stack.isEmpty()) {
			WgslNode node = stack.pop();
			result.add(node);
			List<WgslNode> children = children(node);
			for (int i = children.size() - 1; i >= 0; i--) {
				stack.push(children.get(i));
			}
		}
		return result;
	}

	private static class ExpressionChildren extends WgslExpressionVisitor<List<WgslNode>, RuntimeException> {
		@Override
		public List<WgslNode> visit(WgslIdentifier identifier) {
			return Collections.emptyList();
		}

		@Override
		public List<WgslNode> visit(WgslBoolLiteral boolLiteral) {
			return Collections.emptyList();
		}

		@Override
		public List<WgslNode> visit(WgslIntLiteral intLiteral) {
			return Collections.emptyList();
		}

		@Override
		public List<WgslNode> visit(WgslFloatLiteral floatLiteral) {
			return Collections.emptyList();
		}

		@Override
		public List<WgslNode> visit(WgslParen paren) {
			return Collections.singletonList(paren.getTarget());
		}

		@Override
		public List<WgslNode> visit(WgslUnary unary) {
			return Collections.singletonList(unary.getOperand());
		}

		@Override
		public List<WgslNode> visit(WgslBinop binop) {
			return Arrays.asList(binop.getLHS(), binop.getRHS());
		}

		@Override
		public List<WgslNode> visit(AddedParen addedParen) {
			return visit((WgslParen) addedParen);
		}

		@Override
		public List<WgslNode> visit(ReverseToLhsBinop reverseToLhsBinop) {
			return visit((WgslBinop) reverseToLhsBinop);
		}

		@Override
		public List<WgslNode> visit(ReverseToRhsBinop reverseToRhsBinop) {
			return visit((WgslBinop) reverseToRhsBinop);
		}

		@Override
		public List<WgslNode> visit(KnownFalse knownFalse) {
			return Collections.singletonList(knownFalse.getExpression());
		}

		@Override
		public List<WgslNode> visit(KnownTrue knownTrue) {
			return Collections.singletonList(knownTrue.getExpression());
		}
	}

	private static class StatementChildren extends WgslStatementVisitor<List<WgslNode>, RuntimeException> {
		@Override
		public List<WgslNode> visit(WgslCompound compound) {
			return new ArrayList<>(compound.getStatements());
		}

		@Override
		public List<WgslNode> visit(WgslIf wgslIf) {
			List<WgslNode> children = new ArrayList<>();
			children.add(wgslIf.getCond());
			children.add(wgslIf.getThen());
			if (wgslIf.getElse() != null) {
				children.add(wgslIf.getElse());
			}
			return children;
		}

		@Override
		public List<WgslNode> visit(WgslWhile wgslWhile) {
			return Arrays.asList(wgslWhile.getCond(), wgslWhile.getBody());
		}

		@Override
		public List<WgslNode> visit(WgslAssignment assignment) {
			return Arrays.asList(assignment.getLHS(), assignment.getRHS());
		}

		@Override
		public List<WgslNode> visit(WgslReturn wgslReturn) {
			if (wgslReturn.getValue() == null) {
				return Collections.emptyList();
			}
			return Collections.singletonList(wgslReturn.getValue());
		}

		@Override
		public List<WgslNode> visit(WgslBreak break1) {
			return Collections.emptyList();
		}

		@Override
		public List<WgslNode> visit(WgslContinue continue1) {
			return Collections.emptyList();
		}

		@Override
		public List<WgslNode> visit(WgslDiscard discard) {
			return Collections.emptyList();
		}

		@Override
		public List<WgslNode> visit(DeletableStatement deletableStatement) {
			return Collections.singletonList(deletableStatement.getStatement());
		}

		@Override
		public List<WgslNode> visit(EmptiableCompound emptiableCompound) {
			return visit((WgslCompound) emptiableCompound);
		}

		@Override
		public List<WgslNode> visit(DeadCodeFragment deadCodeFragment) {
			return Collections.singletonList(deadCodeFragment.getStatement());
		}

		@Override
		public List<WgslNode> visit(ControlFlowWrapper controlFlowWrapper) {
			return Collections.singletonList(controlFlowWrapper.getStatement());
		}

		@Override
		public List<WgslNode> visit(WrappedOriginalStatements wrappedOriginalStatements) {
			return visit((WgslCompound) wrappedOriginalStatements);
		}
	}
}
