package sfuzz.formatters;

import sfuzz.model.type.*;

import java.io.IOException;

public class TypeFormattingVisitor extends TypeVisitor<Void, IOException> {
	private final IndentingWriter out;

	public TypeFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	@Override
	public Void visit(BoolType boolType) throws IOException {
		out.write("bool");
		return null;
	}

	@Override
	public Void visit(I32Type i32Type) throws IOException {
		out.write("i32");
		return null;
	}

	@Override
	public Void visit(U32Type u32Type) throws IOException {
		out.write("u32");
		return null;
	}

	@Override
	public Void visit(AbstractIntType abstractIntType) throws IOException {
		out.write("AbstractInt");
		return null;
	}

	@Override
	public Void visit(F16Type f16Type) throws IOException {
		out.write("f16");
		return null;
	}

	@Override
	public Void visit(F32Type f32Type) throws IOException {
		out.write("f32");
		return null;
	}

	@Override
	public Void visit(AbstractFloatType abstractFloatType) throws IOException {
		out.write("AbstractFloat");
		return null;
	}

	@Override
	public Void visit(VectorType vectorType) throws IOException {
		out.write("vec");
		out.write(Integer.toString(vectorType.getWidth()));
		out.write("<");
		vectorType.getElementType().accept(this);
		out.write(">");
		return null;
	}

	@Override
	public Void visit(MatrixType matrixType) throws IOException {
		out.write("mat");
		out.write(Integer.toString(matrixType.getNumCols()));
		out.write("x");
		out.write(Integer.toString(matrixType.getNumRows()));
		out.write("<");
		matrixType.getElementType().accept(this);
		out.write(">");
		return null;
	}

	@Override
	public Void visit(ArrayType arrayType) throws IOException {
		out.write("array<");
		arrayType.getElementType().accept(this);
		if (!arrayType.isRuntimeSized()) {
			out.write(", ");
			out.write(Integer.toString(arrayType.getElementCount()));
		}
		out.write(">");
		return null;
	}

	@Override
	public Void visit(ReferenceType referenceType) throws IOException {
		out.write("ref<");
		out.write(referenceType.getAddressSpace().getWgslName());
		out.write(", ");
		referenceType.getStoreType().accept(this);
		out.write(", ");
		out.write(referenceType.getAccessMode().getWgslName());
		out.write(">");
		return null;
	}
}
