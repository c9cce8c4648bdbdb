package sfuzz.formatters;

import java.io.IOException;
import java.io.Writer;

/**
 * A writer that indents every line it starts by the current indentation level. Lines are always separated by
 * {@code '\n'} so that printed programs are identical across platforms.
 */
public class IndentingWriter extends Writer {

	private static final char NEWLINE = '\n';

	private final Writer out;
	private final int defaultIndent;
	private int indent = 0;
	private boolean atLineStart = true;

	public static class Indent implements AutoCloseable {

		private final IndentingWriter writer;
		private final int spaces;

		public Indent(IndentingWriter writer, int spaces) {
			this.writer = writer;
			this.spaces = spaces;
		}

		@Override
		public void close() {
			writer.unindent(spaces);
		}

	}

	public IndentingWriter(Writer out) {
		this(out, 4);
	}

	public IndentingWriter(Writer out, int defaultIndent) {
		this.out = out;
		this.defaultIndent = defaultIndent;
	}

	public Indent indent(int spaces) {
		indent += spaces;
		return new Indent(this, spaces);
	}

	public Indent indent() {
		return indent(defaultIndent);
	}

	public void unindent(int spaces) {
		if (spaces > indent) {
			throw new IllegalStateException("can't unindent below 0");
		}
		indent -= spaces;
	}

	public int getIndent() {
		return indent;
	}

	/**
	 * @return whether nothing has been written on the current line yet, not even its indentation
	 */
	public boolean isAtLineStart() {
		return atLineStart;
	}

	/**
	 * Writes the current line's indentation now rather than on the next write. Does nothing if the line has already
	 * been started.
	 */
	public void writeIndent() throws IOException {
		if (atLineStart) {
			for (int i = 0; i < indent; ++i) {
				out.write(' ');
			}
			atLineStart = false;
		}
	}

	public void newLine() throws IOException {
		write(NEWLINE);
	}

	@Override
	public void write(char[] chars, int offset, int len) throws IOException {
		int start = offset;
		int end = offset + len;
		while (start < end) {
			int next = start;
			while (next < end && chars[next] != NEWLINE) {
				++next;
			}
			if (next > start) {
				writeIndent();
				out.write(chars, start, next - start);
			}
			if (next == end) {
				break;
			}
			// blank lines are left without trailing spaces
			out.write(NEWLINE);
			atLineStart = true;
			start = next + 1;
		}
	}

	@Override
	public void flush() throws IOException {
		out.flush();
	}

	@Override
	public void close() throws IOException {
		out.close();
	}

}
