package sfuzz.serialization;

import org.json.JSONObject;
import org.junit.Test;
import sfuzz.model.wgsl.*;

import static org.junit.Assert.*;
import static sfuzz.model.wgsl.WgslBuilder.*;

public class WgslJsonDecoderTest {

	@Test
	public void encodedShape() {
		JSONObject json = WgslJsonEncoder.encode(
				new ReverseToLhsBinop(1, "redundant factor removed", times(id("x"), id("y"))));
		assertEquals("reverse_to_lhs_binary", json.getString("kind"));
		assertEquals(1, json.getInt("id"));
		assertEquals("redundant factor removed", json.getString("commentary"));
		assertEquals("*", json.getString("operator"));
		assertEquals("x", json.getJSONObject("lhs").getString("name"));
	}

	@Test
	public void commentaryIsOptional() {
		JSONObject json = WgslJsonEncoder.encode(deletable(2, new WgslBreak()));
		assertFalse(json.has("commentary"));
		DeletableStatement decoded = (DeletableStatement) WgslJsonDecoder.decodeNode(json);
		assertNull(decoded.getCommentary());
	}

	@Test
	public void decodesHandWrittenTree() {
		JSONObject json = new JSONObject(
				"{\"kind\": \"compound\", \"statements\": [" +
				"  {\"kind\": \"assignment\", \"lhs\": {\"kind\": \"identifier\", \"name\": \"x\"}," +
				"   \"rhs\": {\"kind\": \"added_paren\", \"id\": 3," +
				"             \"target\": {\"kind\": \"int_literal\", \"text\": \"7\"}}}," +
				"  {\"kind\": \"return\"}" +
				"]}");
		assertEquals(block(assign(id("x"), new AddedParen(3, null, num("7"))), ret()), WgslJsonDecoder.decodeNode(json));
	}

	@Test(expected = MalformedTreeException.class)
	public void unknownKind() {
		WgslJsonDecoder.decodeNode(new JSONObject("{\"kind\": \"switch\"}"));
	}

	@Test(expected = MalformedTreeException.class)
	public void statementWhereExpressionExpected() {
		WgslJsonDecoder.decodeExpression(new JSONObject("{\"kind\": \"break\"}"));
	}

	@Test(expected = MalformedTreeException.class)
	public void missingField() {
		WgslJsonDecoder.decodeNode(new JSONObject("{\"kind\": \"paren\"}"));
	}

	@Test(expected = MalformedTreeException.class)
	public void wrongFieldType() {
		WgslJsonDecoder.decodeNode(new JSONObject("{\"kind\": \"identifier\", \"name\": 12}"));
	}

	@Test(expected = MalformedTreeException.class)
	public void unknownOperator() {
		WgslJsonDecoder.decodeNode(new JSONObject(
				"{\"kind\": \"binary\", \"operator\": \"**\"," +
				" \"lhs\": {\"kind\": \"identifier\", \"name\": \"a\"}," +
				" \"rhs\": {\"kind\": \"identifier\", \"name\": \"b\"}}"));
	}

	@Test(expected = MalformedTreeException.class)
	public void ifBranchMustBeCompound() {
		WgslJsonDecoder.decodeNode(new JSONObject(
				"{\"kind\": \"if\", \"condition\": {\"kind\": \"bool_literal\", \"value\": true}," +
				" \"then\": {\"kind\": \"break\"}}"));
	}

	@Test(expected = UnsupportedConstructError.class)
	public void deadCodeFragmentIsValidatedOnDecode() {
		WgslJsonDecoder.decodeNode(new JSONObject(
				"{\"kind\": \"dead_code_fragment\", \"id\": 1, \"statement\": {\"kind\": \"discard\"}}"));
	}
}
