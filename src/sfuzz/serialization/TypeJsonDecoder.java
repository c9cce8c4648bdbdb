package sfuzz.serialization;

import org.json.JSONException;
import org.json.JSONObject;
import sfuzz.model.type.*;

public class TypeJsonDecoder {
	private TypeJsonDecoder() {}

	public static Type decode(JSONObject json) {
		try {
			return decodeTagged(json);
		} catch (JSONException e) {
			throw new MalformedTreeException(e.getMessage(), e);
		}
	}

	private static Type decodeTagged(JSONObject json) {
		String kind = json.getString("kind");
		switch (kind) {
			case "bool":
				return new BoolType();
			case "i32":
				return new I32Type();
			case "u32":
				return new U32Type();
			case "abstract_int":
				return new AbstractIntType();
			case "f16":
				return new F16Type();
			case "f32":
				return new F32Type();
			case "abstract_float":
				return new AbstractFloatType();
			case "vector": {
				Type element = decodeTagged(json.getJSONObject("element"));
				if (!(element instanceof ScalarType)) {
					throw new MalformedTreeException("vector element must be a scalar, got " + element);
				}
				try {
					return new VectorType(json.getInt("width"), (ScalarType) element);
				} catch (IllegalArgumentException e) {
					throw new MalformedTreeException(e.getMessage(), e);
				}
			}
			case "matrix": {
				Type element = decodeTagged(json.getJSONObject("element"));
				if (!(element instanceof FloatType)) {
					throw new MalformedTreeException("matrix element must be a float type, got " + element);
				}
				try {
					return new MatrixType(json.getInt("columns"), json.getInt("rows"), (FloatType) element);
				} catch (IllegalArgumentException e) {
					throw new MalformedTreeException(e.getMessage(), e);
				}
			}
			case "array": {
				Integer count = null;
				if (json.has("count")) {
					count = json.getInt("count");
					if (count <= 0) {
						throw new MalformedTreeException("array element count must be positive, got " + count);
					}
				}
				return new ArrayType(decodeTagged(json.getJSONObject("element")), count);
			}
			case "reference":
				try {
					return new ReferenceType(
							decodeTagged(json.getJSONObject("store")),
							AddressSpace.fromWgslName(json.getString("address_space")),
							AccessMode.fromWgslName(json.getString("access_mode")));
				} catch (IllegalArgumentException e) {
					throw new MalformedTreeException(e.getMessage(), e);
				}
			default:
				throw new MalformedTreeException("unknown type kind \"" + kind + "\"");
		}
	}
}
