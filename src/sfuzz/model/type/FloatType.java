package sfuzz.model.type;

/**
 * Floating point scalars, the only types allowed as matrix elements.
 */
public abstract class FloatType extends ScalarType {
}
