package sfuzz.serialization;

import org.json.JSONObject;
import org.junit.Test;
import sfuzz.model.type.*;

import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.*;

public class TypeJsonTest {

	private static final List<Type> TYPES = Arrays.asList(
			new BoolType(),
			new I32Type(),
			new U32Type(),
			new F16Type(),
			new F32Type(),
			new AbstractIntType(),
			new AbstractFloatType(),
			new VectorType(3, new AbstractIntType()),
			new MatrixType(4, 2, new F16Type()),
			new ArrayType(new VectorType(2, new F32Type()), 16),
			new ArrayType(new U32Type(), null),
			new ReferenceType(new ArrayType(new I32Type(), null), AddressSpace.STORAGE, AccessMode.READ_WRITE));

	@Test
	public void everyTypeSurvivesEncoding() {
		for (Type type : TYPES) {
			JSONObject json = type.accept(new TypeJsonEncoder());
			assertEquals(type, TypeJsonDecoder.decode(new JSONObject(json.toString())));
		}
	}

	@Test
	public void vectorShape() {
		JSONObject json = new VectorType(3, new AbstractIntType()).accept(new TypeJsonEncoder());
		assertEquals("vector", json.getString("kind"));
		assertEquals(3, json.getInt("width"));
		assertEquals("abstract_int", json.getJSONObject("element").getString("kind"));
	}

	@Test
	public void runtimeSizedArrayHasNoCount() {
		JSONObject json = new ArrayType(new U32Type(), null).accept(new TypeJsonEncoder());
		assertFalse(json.has("count"));
	}

	@Test
	public void referenceShape() {
		JSONObject json = new ReferenceType(new F32Type(), AddressSpace.WORKGROUP, AccessMode.READ_WRITE)
				.accept(new TypeJsonEncoder());
		assertEquals("workgroup", json.getString("address_space"));
		assertEquals("read_write", json.getString("access_mode"));
	}

	@Test(expected = MalformedTreeException.class)
	public void unknownKind() {
		TypeJsonDecoder.decode(new JSONObject("{\"kind\": \"f64\"}"));
	}

	@Test(expected = MalformedTreeException.class)
	public void badVectorWidth() {
		TypeJsonDecoder.decode(new JSONObject("{\"kind\": \"vector\", \"width\": 7, \"element\": {\"kind\": \"f32\"}}"));
	}

	@Test(expected = MalformedTreeException.class)
	public void matrixOfIntegers() {
		TypeJsonDecoder.decode(new JSONObject(
				"{\"kind\": \"matrix\", \"columns\": 2, \"rows\": 2, \"element\": {\"kind\": \"i32\"}}"));
	}

	@Test(expected = MalformedTreeException.class)
	public void unknownAddressSpace() {
		TypeJsonDecoder.decode(new JSONObject(
				"{\"kind\": \"reference\", \"store\": {\"kind\": \"i32\"}, " +
						"\"address_space\": \"global\", \"access_mode\": \"read\"}"));
	}

	@Test(expected = MalformedTreeException.class)
	public void missingKind() {
		TypeJsonDecoder.decode(new JSONObject("{}"));
	}
}
