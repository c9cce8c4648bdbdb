package sfuzz.formatters;

import sfuzz.model.wgsl.CommentarySink;

import java.io.IOException;

public class IndentingCommentarySink implements CommentarySink {

	private final IndentingWriter out;

	public IndentingCommentarySink(IndentingWriter out) {
		this.out = out;
	}

	@Override
	public void write(String text) throws IOException {
		out.write(text);
	}

	@Override
	public void writeLine(String line) throws IOException {
		out.write(line);
		out.newLine();
	}

	@Override
	public void emitIndent() throws IOException {
		out.writeIndent();
	}

	@Override
	public boolean isAtLineStart() {
		return out.isAtLineStart();
	}
}
