package sfuzz.model.wgsl;

import sfuzz.formatters.IndentingWriter;
import sfuzz.formatters.WgslNodeFormattingVisitor;

import java.io.IOException;
import java.io.StringWriter;

public abstract class WgslNode {

	public abstract <T, E extends Throwable> T accept(WgslNodeVisitor<T, E> v) throws E;

	@Override
	public abstract boolean equals(Object other);

	@Override
	public abstract int hashCode();

	@Override
	public String toString() {
		StringWriter w = new StringWriter();
		IndentingWriter out = new IndentingWriter(w);
		try {
			accept(new WgslNodeFormattingVisitor(out, false));
		} catch (IOException e) {
			throw new RuntimeException("StringWriter should not throw IOException", e);
		}
		return w.toString();
	}

}
