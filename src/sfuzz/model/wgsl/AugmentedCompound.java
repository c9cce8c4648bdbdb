package sfuzz.model.wgsl;

import java.io.IOException;
import java.util.List;
import java.util.Objects;

/**
 * Base class for compound statements that carry a mutation record. They print and traverse like any other compound.
 */
public abstract class AugmentedCompound extends WgslCompound implements AugmentedNode {
	private final int id;
	private final String commentary;

	protected AugmentedCompound(int id, String commentary, List<WgslStatement> statements) {
		super(statements);
		this.id = id;
		this.commentary = commentary;
	}

	@Override
	public int getId() {
		return id;
	}

	@Override
	public String getCommentary() {
		return commentary;
	}

	protected abstract String describe();

	@Override
	public void emitCommentary(CommentarySink sink) throws IOException {
		emitStatementCommentary(sink, describe(), commentary);
	}

	static void emitStatementCommentary(CommentarySink sink, String description, String commentary)
			throws IOException {
		String comment = commentary == null
				? "/* " + description + " */"
				: "/* " + description + ": " + commentary + " */";
		// a block opening an if or while body shares the line with its header
		if (!sink.isAtLineStart()) {
			sink.write(comment + " ");
			return;
		}
		sink.emitIndent();
		sink.writeLine(comment);
	}

	@Override
	public boolean equals(Object o) {
		if (!super.equals(o)) return false;
		AugmentedCompound that = (AugmentedCompound) o;
		return id == that.id && Objects.equals(commentary, that.commentary);
	}

	@Override
	public int hashCode() {
		return Objects.hash(super.hashCode(), id, commentary);
	}
}
