package sfuzz.model.wgsl;

import java.io.IOException;

/**
 * Handed to {@link AugmentedNode#emitCommentary(CommentarySink)} by a printer, so that augmented nodes can explain
 * themselves in the printed program without depending on printer internals.
 */
public interface CommentarySink {
	/**
	 * Writes text on the current line, for comments placed inside an expression.
	 */
	void write(String text) throws IOException;

	/**
	 * Writes text followed by a line break, for comments that precede a statement.
	 */
	void writeLine(String line) throws IOException;

	void emitIndent() throws IOException;

	/**
	 * @return whether nothing has been printed on the current line yet
	 */
	boolean isAtLineStart();
}
