package sfuzz.model.type;

/**
 * Types that may be used as vector elements.
 */
public abstract class ScalarType extends Type {
}
