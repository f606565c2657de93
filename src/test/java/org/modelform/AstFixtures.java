package org.modelform;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;

import org.modelform.ast.RawFragment;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

/** Builds model AST documents in the modelica-json shape for tests */
public class AstFixtures {
	private AstFixtures() {
	}

	/**
	 * @param within The package the document's classes are in, or null
	 * @param classes The class definitions in the document
	 * @return The document
	 */
	public static JsonObject document(String within, JsonObject... classes) {
		JsonObject doc = new JsonObject();
		if (within != null)
			doc.addProperty("within", within);
		JsonArray classDefs = new JsonArray();
		for (JsonObject c : classes)
			classDefs.add(c);
		doc.add("class_definition", classDefs);
		return doc;
	}

	/**
	 * @param source The source name for the fragment
	 * @param within The package the document's classes are in, or null
	 * @param classes The class definitions in the document
	 * @return The fragment
	 */
	public static RawFragment fragment(String source, String within, JsonObject... classes) {
		return new RawFragment(source, document(within, classes));
	}

	/**
	 * @param prefix The class prefix
	 * @param identifier The class name
	 * @param description The class description, or null
	 * @param elements The elements of the class: component clauses, extends clauses and nested class definitions
	 * @return The class definition
	 */
	public static JsonObject classDef(String prefix, String identifier, String description, JsonObject... elements) {
		JsonObject longSpec = new JsonObject();
		longSpec.addProperty("identifier", identifier);
		if (description != null)
			longSpec.addProperty("description_string", description);
		JsonArray elementList = new JsonArray();
		for (JsonObject el : elements)
			elementList.add(el);
		JsonObject composition = new JsonObject();
		composition.add("element_list", elementList);
		longSpec.add("composition", composition);
		JsonObject specifier = new JsonObject();
		specifier.add("long_class_specifier", longSpec);
		JsonObject classDef = new JsonObject();
		classDef.addProperty("class_prefixes", prefix);
		classDef.add("class_specifier", specifier);
		return classDef;
	}

	/**
	 * @param identifier The alias name
	 * @param type The aliased type
	 * @return A short class definition declaring the alias
	 */
	public static JsonObject alias(String identifier, String type) {
		JsonObject name = new JsonObject();
		name.addProperty("name", type);
		JsonObject shortSpec = new JsonObject();
		shortSpec.addProperty("identifier", identifier);
		shortSpec.add("value", name);
		JsonObject specifier = new JsonObject();
		specifier.add("short_class_specifier", shortSpec);
		JsonObject classDef = new JsonObject();
		classDef.addProperty("class_prefixes", "type");
		classDef.add("class_specifier", specifier);
		return classDef;
	}

	/**
	 * @param classDef The class definition to nest
	 * @return The element declaring the nested class
	 */
	public static JsonObject nested(JsonObject classDef) {
		JsonObject el = new JsonObject();
		el.add("class_definition", classDef);
		return el;
	}

	/**
	 * @param type The type specifier
	 * @param identifier The component name
	 * @param modification The modification, or null
	 * @param description The label text, or null
	 * @param enable The enable annotation value, or null for none
	 * @return The component clause element
	 */
	public static JsonObject component(String type, String identifier, JsonObject modification, String description, JsonElement enable) {
		JsonObject declaration = new JsonObject();
		declaration.addProperty("identifier", identifier);
		if (modification != null)
			declaration.add("modification", modification);
		JsonObject comp = new JsonObject();
		comp.add("declaration", declaration);
		if (description != null || enable != null) {
			JsonObject desc = new JsonObject();
			if (description != null)
				desc.addProperty("description_string", description);
			if (enable != null)
				desc.add("annotation", annotation(arg("Dialog", mod(null, arg("enable", mod(enable))))));
			comp.add("description", desc);
		}
		JsonArray list = new JsonArray();
		list.add(comp);
		JsonObject clause = new JsonObject();
		clause.addProperty("type_specifier", type);
		clause.add("component_list", list);
		JsonObject el = new JsonObject();
		el.add("component_clause", clause);
		return el;
	}

	/**
	 * @param type The type specifier
	 * @param identifier The component name
	 * @param value The text of the declared value, or null
	 * @return The component clause element
	 */
	public static JsonObject component(String type, String identifier, String value) {
		return component(type, identifier, value == null ? null : mod(expr(value)), null, null);
	}

	/**
	 * @param base The base class name
	 * @param args The modification arguments
	 * @return The extends clause element
	 */
	public static JsonObject extendsClause(String base, JsonObject... args) {
		JsonObject ext = new JsonObject();
		ext.addProperty("name", base);
		if (args.length > 0)
			ext.add("class_modification", array(args));
		JsonObject el = new JsonObject();
		el.add("extends_clause", ext);
		return el;
	}

	/**
	 * @param value The value expression, or null
	 * @param args The nested arguments
	 * @return The modification
	 */
	public static JsonObject mod(JsonElement value, JsonObject... args) {
		JsonObject mod = new JsonObject();
		if (value != null) {
			mod.addProperty("equal", true);
			mod.add("expression", value);
		}
		if (args.length > 0)
			mod.add("class_modification", array(args));
		return mod;
	}

	/**
	 * @param name The argument name, possibly dotted
	 * @param modification The argument's modification
	 * @return The class modification argument
	 */
	public static JsonObject arg(String name, JsonObject modification) {
		JsonObject elMod = new JsonObject();
		elMod.addProperty("name", name);
		elMod.add("modification", modification);
		JsonObject wrapper = new JsonObject();
		wrapper.add("element_modification", elMod);
		JsonObject arg = new JsonObject();
		arg.add("element_modification_or_replaceable", wrapper);
		return arg;
	}

	/**
	 * @param name The argument name, possibly dotted
	 * @param value The text of the argument's value
	 * @return The class modification argument
	 */
	public static JsonObject arg(String name, String value) {
		return arg(name, mod(expr(value)));
	}

	/**
	 * @param text The modelica text of the expression
	 * @return The expression in its simple_expression form
	 */
	public static JsonObject expr(String text) {
		JsonObject expr = new JsonObject();
		expr.addProperty("simple_expression", text);
		return expr;
	}

	private static JsonArray annotation(JsonObject... args) {
		return array(args);
	}

	private static JsonArray array(JsonObject... items) {
		JsonArray array = new JsonArray();
		for (JsonObject item : items)
			array.add(item);
		return array;
	}

	/**
	 * @param resource The classpath resource, relative to the models directory
	 * @return The fragment in the resource
	 * @throws IOException If the resource cannot be read
	 */
	public static RawFragment resource(String resource) throws IOException {
		try (Reader reader = new InputStreamReader(AstFixtures.class.getResourceAsStream("/models/" + resource), StandardCharsets.UTF_8)) {
			return RawFragment.read(resource, reader);
		}
	}
}
