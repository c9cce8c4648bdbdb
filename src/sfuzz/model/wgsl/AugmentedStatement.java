package sfuzz.model.wgsl;

import java.io.IOException;
import java.util.Objects;

/**
 * Base class for augmented statements that wrap exactly one statement.
 */
public abstract class AugmentedStatement extends WgslStatement implements AugmentedNode {
	private final int id;
	private final String commentary;
	private final WgslStatement statement;

	protected AugmentedStatement(int id, String commentary, WgslStatement statement) {
		this.id = id;
		this.commentary = commentary;
		this.statement = statement;
	}

	public WgslStatement getStatement() {
		return statement;
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
		AugmentedCompound.emitStatementCommentary(sink, describe(), commentary);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		AugmentedStatement that = (AugmentedStatement) o;
		return id == that.id &&
				Objects.equals(commentary, that.commentary) &&
				Objects.equals(statement, that.statement);
	}

	@Override
	public int hashCode() {
		return Objects.hash(getClass().getSimpleName(), id, commentary, statement);
	}
}
