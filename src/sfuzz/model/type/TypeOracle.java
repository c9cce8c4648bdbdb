package sfuzz.model.type;

import sfuzz.model.wgsl.WgslExpression;

/**
 * Maps an expression to the type a resolver has already inferred for it.
 */
public interface TypeOracle {
	Type typeOf(WgslExpression expression);
}
