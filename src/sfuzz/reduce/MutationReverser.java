package sfuzz.reduce;

import sfuzz.InternalFuzzerError;
import sfuzz.model.wgsl.*;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Rebuilds a tree with a chosen set of mutations undone. Every augmented node whose id is selected is reversed against
 * the node as found in the input tree, and the replacement is then rewritten in turn, so nested mutations compose.
 *
 * Deleted statements are removed from their enclosing compound, and a deleted else branch is dropped from its if. A
 * deletion in any other statement position leaves an empty compound behind.
 */
public class MutationReverser {
	private static final Logger logger = Logger.getLogger("sfuzz.reduce");

	private final Set<Integer> ids;

	public MutationReverser(Collection<Integer> ids) {
		this.ids = new HashSet<>(ids);
	}

	/**
	 * @return the rewritten tree, or empty if the root itself was deleted
	 */
	public Optional<WgslNode> reverse(WgslNode root) {
		return root.accept(new WgslNodeVisitor<Optional<WgslNode>, RuntimeException>() {
			@Override
			public Optional<WgslNode> visit(WgslExpression expression) {
				return Optional.of(rewrite(expression));
			}

			@Override
			public Optional<WgslNode> visit(WgslStatement statement) {
				return rewrite(statement).map(s -> (WgslNode) s);
			}
		});
	}

	public WgslExpression rewrite(WgslExpression expression) {
		return expression.accept(new ExpressionRewriter());
	}

	public Optional<WgslStatement> rewrite(WgslStatement statement) {
		return statement.accept(new StatementRewriter());
	}

	private boolean isSelected(AugmentedNode node) {
		return ids.contains(node.getId());
	}

	private ReversalResult reverseLogged(AugmentedNode node, WgslNode current) {
		ReversalResult result = node.reverse(current);
		logger.fine("reversed mutation " + node.getId() + " (" + node.getClass().getSimpleName() + ")");
		return result;
	}

	private WgslExpression reverseExpression(AugmentedNode node, WgslNode current) {
		return reverseLogged(node, current).accept(new ReversalResultVisitor<WgslExpression, RuntimeException>() {
			@Override
			public WgslExpression visit(ReplaceWithNode replaceWithNode) {
				if (!(replaceWithNode.getReplacement() instanceof WgslExpression)) {
					throw new InternalFuzzerError("reversing an expression must yield an expression");
				}
				return rewrite((WgslExpression) replaceWithNode.getReplacement());
			}

			@Override
			public WgslExpression visit(DeleteNode deleteNode) {
				throw new InternalFuzzerError("an expression cannot be deleted");
			}
		});
	}

	private Optional<WgslStatement> reverseStatement(AugmentedNode node, WgslNode current) {
		return reverseLogged(node, current).accept(new ReversalResultVisitor<Optional<WgslStatement>, RuntimeException>() {
			@Override
			public Optional<WgslStatement> visit(ReplaceWithNode replaceWithNode) {
				if (!(replaceWithNode.getReplacement() instanceof WgslStatement)) {
					throw new InternalFuzzerError("reversing a statement must yield a statement");
				}
				return rewrite((WgslStatement) replaceWithNode.getReplacement());
			}

			@Override
			public Optional<WgslStatement> visit(DeleteNode deleteNode) {
				return Optional.empty();
			}
		});
	}

	private class ExpressionRewriter extends WgslExpressionVisitor<WgslExpression, RuntimeException> {
		@Override
		public WgslExpression visit(WgslIdentifier identifier) {
			return identifier;
		}

		@Override
		public WgslExpression visit(WgslBoolLiteral boolLiteral) {
			return boolLiteral;
		}

		@Override
		public WgslExpression visit(WgslIntLiteral intLiteral) {
			return intLiteral;
		}

		@Override
		public WgslExpression visit(WgslFloatLiteral floatLiteral) {
			return floatLiteral;
		}

		@Override
		public WgslExpression visit(WgslParen paren) {
			return new WgslParen(paren.getTarget().accept(this));
		}

		@Override
		public WgslExpression visit(WgslUnary unary) {
			return new WgslUnary(unary.getOperation(), unary.getOperand().accept(this));
		}

		@Override
		public WgslExpression visit(WgslBinop binop) {
			return new WgslBinop(binop.getOperation(), binop.getLHS().accept(this), binop.getRHS().accept(this));
		}

		@Override
		public WgslExpression visit(AddedParen addedParen) {
			if (isSelected(addedParen)) {
				return reverseExpression(addedParen, addedParen);
			}
			return new AddedParen(addedParen.getId(), addedParen.getCommentary(), addedParen.getTarget().accept(this));
		}

		@Override
		public WgslExpression visit(ReverseToLhsBinop binop) {
			if (isSelected(binop)) {
				return reverseExpression(binop, binop);
			}
			return new ReverseToLhsBinop(
					binop.getId(),
					binop.getCommentary(),
					binop.getOperation(),
					binop.getLHS().accept(this),
					binop.getRHS().accept(this));
		}

		@Override
		public WgslExpression visit(ReverseToRhsBinop binop) {
			if (isSelected(binop)) {
				return reverseExpression(binop, binop);
			}
			return new ReverseToRhsBinop(
					binop.getId(),
					binop.getCommentary(),
					binop.getOperation(),
					binop.getLHS().accept(this),
					binop.getRHS().accept(this));
		}

		@Override
		public WgslExpression visit(KnownFalse knownFalse) {
			if (isSelected(knownFalse)) {
				return reverseExpression(knownFalse, knownFalse);
			}
			return new KnownFalse(knownFalse.getId(), knownFalse.getCommentary(), knownFalse.getExpression().accept(this));
		}

		@Override
		public WgslExpression visit(KnownTrue knownTrue) {
			if (isSelected(knownTrue)) {
				return reverseExpression(knownTrue, knownTrue);
			}
			return new KnownTrue(knownTrue.getId(), knownTrue.getCommentary(), knownTrue.getExpression().accept(this));
		}
	}

	private class StatementRewriter extends WgslStatementVisitor<Optional<WgslStatement>, RuntimeException> {
		private final ExpressionRewriter expressions = new ExpressionRewriter();

		private List<WgslStatement> rewriteAll(List<WgslStatement> statements) {
			List<WgslStatement> result = new ArrayList<>(statements.size());
			for (WgslStatement statement : statements) {
				statement.accept(this).ifPresent(result::add);
			}
			return result;
		}

		private WgslStatement rewriteSlot(WgslStatement statement) {
			return statement.accept(this).orElseGet(() -> new WgslCompound(Collections.emptyList()));
		}

		private WgslCompound rewriteBlock(WgslCompound compound) {
			WgslStatement result = rewriteSlot(compound);
			if (result instanceof WgslCompound) {
				return (WgslCompound) result;
			}
			return new WgslCompound(Collections.singletonList(result));
		}

		@Override
		public Optional<WgslStatement> visit(WgslCompound compound) {
			return Optional.of(new WgslCompound(rewriteAll(compound.getStatements())));
		}

		@Override
		public Optional<WgslStatement> visit(WgslIf wgslIf) {
			WgslStatement bElse = null;
			if (wgslIf.getElse() != null) {
				bElse = wgslIf.getElse().accept(this).orElse(null);
			}
			return Optional.of(new WgslIf(
					wgslIf.getCond().accept(expressions),
					rewriteBlock(wgslIf.getThen()),
					bElse));
		}

		@Override
		public Optional<WgslStatement> visit(WgslWhile wgslWhile) {
			return Optional.of(new WgslWhile(wgslWhile.getCond().accept(expressions), rewriteBlock(wgslWhile.getBody())));
		}

		@Override
		public Optional<WgslStatement> visit(WgslAssignment assignment) {
			return Optional.of(new WgslAssignment(
					assignment.getLHS().accept(expressions), assignment.getRHS().accept(expressions)));
		}

		@Override
		public Optional<WgslStatement> visit(WgslReturn wgslReturn) {
			if (wgslReturn.getValue() == null) {
				return Optional.of(wgslReturn);
			}
			return Optional.of(new WgslReturn(wgslReturn.getValue().accept(expressions)));
		}

		@Override
		public Optional<WgslStatement> visit(WgslBreak break1) {
			return Optional.of(break1);
		}

		@Override
		public Optional<WgslStatement> visit(WgslContinue continue1) {
			return Optional.of(continue1);
		}

		@Override
		public Optional<WgslStatement> visit(WgslDiscard discard) {
			return Optional.of(discard);
		}

		@Override
		public Optional<WgslStatement> visit(DeletableStatement deletableStatement) {
			if (isSelected(deletableStatement)) {
				return reverseStatement(deletableStatement, deletableStatement);
			}
			return Optional.of(new DeletableStatement(
					deletableStatement.getId(),
					deletableStatement.getCommentary(),
					rewriteSlot(deletableStatement.getStatement())));
		}

		@Override
		public Optional<WgslStatement> visit(EmptiableCompound emptiableCompound) {
			if (isSelected(emptiableCompound)) {
				return reverseStatement(emptiableCompound, emptiableCompound);
			}
			return Optional.of(new EmptiableCompound(
					emptiableCompound.getId(),
					emptiableCompound.getCommentary(),
					rewriteAll(emptiableCompound.getStatements())));
		}

		@Override
		public Optional<WgslStatement> visit(DeadCodeFragment deadCodeFragment) {
			if (isSelected(deadCodeFragment)) {
				return reverseStatement(deadCodeFragment, deadCodeFragment);
			}
			WgslStatement statement = rewriteSlot(deadCodeFragment.getStatement());
			if (!hasKnownFalseGuard(statement)) {
				logger.fine("dropping dead code fragment " + deadCodeFragment.getId() + " as its guard was reversed");
				return Optional.of(statement);
			}
			return Optional.of(new DeadCodeFragment(
					deadCodeFragment.getId(), deadCodeFragment.getCommentary(), statement));
		}

		@Override
		public Optional<WgslStatement> visit(ControlFlowWrapper controlFlowWrapper) {
			if (isSelected(controlFlowWrapper)) {
				return reverseStatement(controlFlowWrapper, controlFlowWrapper);
			}
			return Optional.of(new ControlFlowWrapper(
					controlFlowWrapper.getId(),
					controlFlowWrapper.getCommentary(),
					rewriteSlot(controlFlowWrapper.getStatement())));
		}

		@Override
		public Optional<WgslStatement> visit(WrappedOriginalStatements wrappedOriginalStatements) {
			if (isSelected(wrappedOriginalStatements)) {
				return reverseStatement(wrappedOriginalStatements, wrappedOriginalStatements);
			}
			return Optional.of(new WrappedOriginalStatements(
					wrappedOriginalStatements.getId(),
					wrappedOriginalStatements.getCommentary(),
					rewriteAll(wrappedOriginalStatements.getStatements())));
		}
	}

	private static boolean hasKnownFalseGuard(WgslStatement statement) {
		if (statement instanceof WgslIf) {
			return ((WgslIf) statement).getCond() instanceof KnownFalse;
		}
		if (statement instanceof WgslWhile) {
			return ((WgslWhile) statement).getCond() instanceof KnownFalse;
		}
		return false;
	}
}
