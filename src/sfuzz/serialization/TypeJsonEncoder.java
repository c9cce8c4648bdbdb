package sfuzz.serialization;

import org.json.JSONObject;
import sfuzz.model.type.*;

public class TypeJsonEncoder extends TypeVisitor<JSONObject, RuntimeException> {

	private static JSONObject tagged(String kind) {
		JSONObject result = new JSONObject();
		result.put("kind", kind);
		return result;
	}

	@Override
	public JSONObject visit(BoolType boolType) {
		return tagged("bool");
	}

	@Override
	public JSONObject visit(I32Type i32Type) {
		return tagged("i32");
	}

	@Override
	public JSONObject visit(U32Type u32Type) {
		return tagged("u32");
	}

	@Override
	public JSONObject visit(AbstractIntType abstractIntType) {
		return tagged("abstract_int");
	}

	@Override
	public JSONObject visit(F16Type f16Type) {
		return tagged("f16");
	}

	@Override
	public JSONObject visit(F32Type f32Type) {
		return tagged("f32");
	}

	@Override
	public JSONObject visit(AbstractFloatType abstractFloatType) {
		return tagged("abstract_float");
	}

	@Override
	public JSONObject visit(VectorType vectorType) {
		JSONObject result = tagged("vector");
		result.put("width", vectorType.getWidth());
		result.put("element", vectorType.getElementType().accept(this));
		return result;
	}

	@Override
	public JSONObject visit(MatrixType matrixType) {
		JSONObject result = tagged("matrix");
		result.put("columns", matrixType.getNumCols());
		result.put("rows", matrixType.getNumRows());
		result.put("element", matrixType.getElementType().accept(this));
		return result;
	}

	@Override
	public JSONObject visit(ArrayType arrayType) {
		JSONObject result = tagged("array");
		result.put("element", arrayType.getElementType().accept(this));
		if (!arrayType.isRuntimeSized()) {
			result.put("count", arrayType.getElementCount().intValue());
		}
		return result;
	}

	@Override
	public JSONObject visit(ReferenceType referenceType) {
		JSONObject result = tagged("reference");
		result.put("store", referenceType.getStoreType().accept(this));
		result.put("address_space", referenceType.getAddressSpace().getWgslName());
		result.put("access_mode", referenceType.getAccessMode().getWgslName());
		return result;
	}
}
