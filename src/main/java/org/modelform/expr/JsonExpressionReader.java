package org.modelform.expr;

import java.util.ArrayList;
import java.util.List;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

/**
 * Reads expressions from the JSON forms they take in a model AST:
 * <ul>
 * <li><code>{"simple_expression": "a == true"}</code> or a bare JSON string: expression text, parsed by an {@link ExpressionParser}</li>
 * <li><code>{"operator": "==", "operands": [...]}</code>: a structured expression whose operands are JSON literals,
 * <code>{"name": "a.b"}</code> variable references or nested structured expressions</li>
 * </ul>
 */
public class JsonExpressionReader {
	private final ExpressionParser theParser;

	/** @param parser The parser for expression text */
	public JsonExpressionReader(ExpressionParser parser) {
		theParser = parser;
	}

	/** @return The parser for expression text */
	public ExpressionParser getParser() {
		return theParser;
	}

	/**
	 * @param json The JSON expression
	 * @return The expression
	 * @throws ExpressionParseException If the JSON does not represent an expression
	 */
	public Expression read(JsonElement json) throws ExpressionParseException {
		if (json == null || json.isJsonNull())
			throw new ExpressionParseException(0, 0, "null", "Missing expression");
		else if (json.isJsonPrimitive()) {
			if (json.getAsJsonPrimitive().isString())
				return theParser.parse(json.getAsString());
			return Literal.of(Values.fromJson(json));
		} else if (!json.isJsonObject())
			throw new ExpressionParseException(0, 0, json.toString(), "Unrecognized expression structure");
		JsonObject obj = json.getAsJsonObject();
		if (obj.has("simple_expression"))
			return readSimple(obj.get("simple_expression"));
		else if (obj.has("operator"))
			return readStructured(obj);
		throw new ExpressionParseException(0, 0, json.toString(), "Unrecognized expression structure");
	}

	private Expression readSimple(JsonElement simple) throws ExpressionParseException {
		if (simple.isJsonPrimitive()) {
			if (simple.getAsJsonPrimitive().isString())
				return theParser.parse(simple.getAsString());
			return Literal.of(Values.fromJson(simple));
		}
		return read(simple);
	}

	private Expression readStructured(JsonObject obj) throws ExpressionParseException {
		JsonElement operator = obj.get("operator");
		if (!operator.isJsonPrimitive() || !operator.getAsJsonPrimitive().isString())
			throw new ExpressionParseException(0, 0, obj.toString(), "Operator must be a string");
		JsonElement operandsJson = obj.get("operands");
		if (operandsJson == null || !operandsJson.isJsonArray())
			throw new ExpressionParseException(0, 0, obj.toString(), "Operands must be an array");
		JsonArray array = operandsJson.getAsJsonArray();
		List<Expression> operands = new ArrayList<>(array.size());
		for (JsonElement operand : array)
			operands.add(readOperand(operand));
		return new OperatorExpression(operator.getAsString(), operands);
	}

	private Expression readOperand(JsonElement operand) throws ExpressionParseException {
		if (operand == null || operand.isJsonNull())
			throw new ExpressionParseException(0, 0, "null", "Missing operand");
		else if (operand.isJsonPrimitive())
			return Literal.of(Values.fromJson(operand)); // Strings in operand position are literals, not expression text
		else if (operand.isJsonObject() && operand.getAsJsonObject().has("name")) {
			JsonElement name = operand.getAsJsonObject().get("name");
			if (!name.isJsonPrimitive() || name.getAsString().isEmpty())
				throw new ExpressionParseException(0, 0, operand.toString(), "Bad variable reference");
			return new VariableReference(name.getAsString());
		}
		return read(operand);
	}
}
