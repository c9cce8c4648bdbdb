package sfuzz.model.wgsl;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

public class WgslCompound extends WgslStatement {

	private final List<WgslStatement> statements;

	public WgslCompound(List<WgslStatement> statements) {
		this.statements = Collections.unmodifiableList(new ArrayList<>(statements));
	}

	public List<WgslStatement> getStatements(){
		return statements;
	}

	@Override
	public <T, E extends Throwable> T accept(WgslStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		WgslCompound compound = (WgslCompound) o;
		return Objects.equals(statements, compound.statements);
	}

	@Override
	public int hashCode() {
		return Objects.hash(statements);
	}
}
