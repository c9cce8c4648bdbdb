package sfuzz.model.wgsl;

import java.util.Collections;
import java.util.List;

/**
 * A compound whose contents were generated by a mutation. Undoing the mutation leaves an empty compound in place, since
 * the enclosing construct may still need a block.
 */
public class EmptiableCompound extends AugmentedCompound {

	public EmptiableCompound(int id, String commentary, List<WgslStatement> statements) {
		super(id, commentary, statements);
	}

	@Override
	public ReversalResult reverse(WgslNode current) {
		return new ReplaceWithNode(new WgslCompound(Collections.emptyList()));
	}

	@Override
	protected String describe() {
		return "emptiable compound";
	}

	@Override
	public <T, E extends Throwable> T accept(WgslStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
