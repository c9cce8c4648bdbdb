package sfuzz.model.type;

import sfuzz.formatters.IndentingWriter;
import sfuzz.formatters.TypeFormattingVisitor;

import java.io.IOException;
import java.io.StringWriter;

/**
 * A resolved WGSL type. Types are immutable values compared structurally; they are produced by a resolver and never
 * mutated afterwards.
 */
public abstract class Type {
	/**
	 * Numeric scalars, and vectors, matrices and arrays of them, can be abstract. By default types are not.
	 *
	 * @return whether this type only exists before concretization
	 */
	public boolean isAbstract() {
		return false;
	}

	@Override
	public abstract int hashCode();

	@Override
	public abstract boolean equals(Object obj);

	@Override
	public String toString() {
		StringWriter writer = new StringWriter();
		try {
			this.accept(new TypeFormattingVisitor(new IndentingWriter(writer)));
		} catch (IOException e) {
			throw new RuntimeException("StringWriter should not throw IOException", e);
		}
		return writer.toString();
	}

	public abstract <T, E extends Throwable> T accept(TypeVisitor<T, E> v) throws E;
}
