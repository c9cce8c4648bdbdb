package sfuzz.model.type;

public abstract class IntegerType extends ScalarType {
}
