package org.modelform.ast;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;

/**
 * Reads the modelica-json AST structure (<code>class_definition</code>, <code>composition</code>, <code>element_list</code>,
 * <code>component_clause</code>, <code>declaration</code>, <code>modification</code>, <code>annotation</code>, ...) into
 * {@link ModelDocument}s
 */
public class AstReader {
	/** The name of the annotation holding dialog properties */
	public static final String DIALOG = "Dialog";
	/** The name of the dialog property holding the enablement condition */
	public static final String ENABLE = "enable";

	private AstReader() {
	}

	/**
	 * @param fragment The raw fragment to read
	 * @return The document
	 * @throws IOException If the fragment does not follow the AST structure
	 */
	public static ModelDocument read(RawFragment fragment) throws IOException {
		JsonObject doc = fragment.getDocument();
		String within = getString(doc, "within");
		List<ClassDeclaration> classes = new ArrayList<>();
		for (JsonElement classDef : elements(doc.get("class_definition")))
			classes.add(readClass(fragment, classDef));
		if (classes.isEmpty())
			throw new IOException(fragment.getSource() + " defines no classes");
		return new ModelDocument(fragment.getSource(), within, classes);
	}

	private static ClassDeclaration readClass(RawFragment fragment, JsonElement json) throws IOException {
		JsonObject classDef = object(fragment, json, "class_definition");
		String prefix = getString(classDef, "class_prefixes");
		JsonObject specifier = object(fragment, classDef.get("class_specifier"), "class_specifier");
		if (specifier.has("short_class_specifier")) {
			JsonObject shortSpec = object(fragment, specifier.get("short_class_specifier"), "short_class_specifier");
			String identifier = requireString(fragment, shortSpec, "identifier");
			String aliasOf = null;
			JsonElement value = shortSpec.get("value");
			if (value != null && value.isJsonObject())
				aliasOf = getString(value.getAsJsonObject(), "name");
			else if (value != null && value.isJsonPrimitive())
				aliasOf = value.getAsString();
			if (aliasOf == null)
				throw new IOException(fragment.getSource() + ": short class " + identifier + " does not name a type");
			return new ClassDeclaration(identifier, prefix, getString(shortSpec, "description_string"), aliasOf,
				Collections.<ComponentDeclaration> emptyList(), Collections.<ExtendsDeclaration> emptyList(),
				Collections.<ClassDeclaration> emptyList());
		}
		JsonObject longSpec = object(fragment, specifier.get("long_class_specifier"), "long_class_specifier");
		String identifier = requireString(fragment, longSpec, "identifier");
		List<ComponentDeclaration> components = new ArrayList<>();
		List<ExtendsDeclaration> extendsClauses = new ArrayList<>();
		List<ClassDeclaration> nested = new ArrayList<>();
		JsonElement composition = longSpec.get("composition");
		if (composition != null && composition.isJsonObject()) {
			JsonObject comp = composition.getAsJsonObject();
			readElements(fragment, comp.get("element_list"), components, extendsClauses, nested);
			// Only public sections are visible to a form; protected elements are skipped
			for (JsonElement section : elements(comp.get("element_sections"))) {
				if (section.isJsonObject())
					readElements(fragment, section.getAsJsonObject().get("public_element_list"), components, extendsClauses, nested);
			}
		}
		return new ClassDeclaration(identifier, prefix, getString(longSpec, "description_string"), null, components, extendsClauses,
			nested);
	}

	private static void readElements(RawFragment fragment, JsonElement elementList, List<ComponentDeclaration> components,
		List<ExtendsDeclaration> extendsClauses, List<ClassDeclaration> nested) throws IOException {
		for (JsonElement element : elements(elementList)) {
			if (!element.isJsonObject())
				continue;
			JsonObject el = element.getAsJsonObject();
			if (el.has("component_clause"))
				readComponentClause(fragment, object(fragment, el.get("component_clause"), "component_clause"), components);
			else if (el.has("extends_clause")) {
				JsonObject ext = object(fragment, el.get("extends_clause"), "extends_clause");
				extendsClauses.add(new ExtendsDeclaration(requireString(fragment, ext, "name"),
					new Modification(null, readArguments(fragment, ext.get("class_modification")))));
			} else if (el.has("class_definition"))
				nested.add(readClass(fragment, el.get("class_definition")));
			// Import clauses and other elements carry nothing a form needs
		}
	}

	private static void readComponentClause(RawFragment fragment, JsonObject clause, List<ComponentDeclaration> components)
		throws IOException {
		String type = requireString(fragment, clause, "type_specifier");
		for (JsonElement compJson : elements(clause.get("component_list"))) {
			JsonObject comp = object(fragment, compJson, "component_list");
			JsonObject declaration = object(fragment, comp.get("declaration"), "declaration");
			String identifier = requireString(fragment, declaration, "identifier");
			Modification modification = readModification(fragment, declaration.get("modification"));
			String description = null;
			JsonElement enable = null;
			JsonElement descJson = comp.get("description");
			if (descJson != null && descJson.isJsonObject()) {
				JsonObject desc = descJson.getAsJsonObject();
				description = getString(desc, "description_string");
				enable = findEnable(fragment, desc.get("annotation"));
			}
			components.add(new ComponentDeclaration(identifier, type, modification, description, enable));
		}
	}

	/**
	 * @param fragment The fragment being read
	 * @param json The JSON of a <code>modification</code>
	 * @return The modification
	 * @throws IOException If the JSON does not follow the modification structure
	 */
	static Modification readModification(RawFragment fragment, JsonElement json) throws IOException {
		if (json == null || json.isJsonNull())
			return Modification.NONE;
		JsonObject mod = object(fragment, json, "modification");
		JsonElement value = null;
		if (mod.has("expression"))
			value = mod.get("expression");
		Map<String, Modification> args = readArguments(fragment, mod.get("class_modification"));
		if (value == null && args.isEmpty())
			return Modification.NONE;
		return new Modification(value, args);
	}

	private static Map<String, Modification> readArguments(RawFragment fragment, JsonElement json) throws IOException {
		if (json == null || json.isJsonNull())
			return Collections.emptyMap();
		if (json.isJsonObject() && json.getAsJsonObject().has("argument_list"))
			json = json.getAsJsonObject().get("argument_list");
		Map<String, Modification> args = new LinkedHashMap<>();
		for (JsonElement argJson : elements(json)) {
			JsonObject elMod = elementModification(argJson);
			if (elMod == null)
				continue; // Redeclarations and replaceables are not overrides
			String name = requireString(fragment, elMod, "name");
			args.put(name, readModification(fragment, elMod.get("modification")));
		}
		return args;
	}

	private static JsonObject elementModification(JsonElement argJson) {
		if (argJson == null || !argJson.isJsonObject())
			return null;
		JsonObject arg = argJson.getAsJsonObject();
		if (arg.has("element_modification_or_replaceable")) {
			JsonElement inner = arg.get("element_modification_or_replaceable");
			if (!inner.isJsonObject())
				return null;
			arg = inner.getAsJsonObject();
		}
		JsonElement elMod = arg.get("element_modification");
		return elMod != null && elMod.isJsonObject() ? elMod.getAsJsonObject() : null;
	}

	/**
	 * Finds the <code>enable</code> value in an annotation, either inside its <code>Dialog</code> argument or at the top level
	 *
	 * @param fragment The fragment being read
	 * @param annotation The JSON of the annotation
	 * @return The raw JSON of the enable expression, or null if the annotation has none
	 * @throws IOException If the annotation does not follow the modification structure
	 */
	static JsonElement findEnable(RawFragment fragment, JsonElement annotation) throws IOException {
		if (annotation == null || annotation.isJsonNull())
			return null;
		if (annotation.isJsonObject() && annotation.getAsJsonObject().has("class_modification"))
			annotation = annotation.getAsJsonObject().get("class_modification");
		Map<String, Modification> args = readArguments(fragment, annotation);
		Modification dialog = args.get(DIALOG);
		if (dialog != null) {
			Modification enable = dialog.getArguments().get(ENABLE);
			if (enable != null)
				return enable.getValue() != null ? enable.getValue() : MISSING_VALUE;
		}
		Modification enable = args.get(ENABLE);
		if (enable != null)
			return enable.getValue() != null ? enable.getValue() : MISSING_VALUE;
		return null;
	}

	/** Stands in for an enable annotation present without a value, which is then reported as malformed */
	static final JsonElement MISSING_VALUE = JsonNull.INSTANCE;

	private static List<JsonElement> elements(JsonElement json) {
		if (json == null || json.isJsonNull())
			return Collections.emptyList();
		else if (json.isJsonArray()) {
			List<JsonElement> list = new ArrayList<>(json.getAsJsonArray().size());
			for (JsonElement el : json.getAsJsonArray())
				list.add(el);
			return list;
		} else
			return Collections.singletonList(json);
	}

	private static JsonObject object(RawFragment fragment, JsonElement json, String what) throws IOException {
		if (json == null || !json.isJsonObject())
			throw new IOException(fragment.getSource() + ": expected an object for " + what + ", found " + json);
		return json.getAsJsonObject();
	}

	private static String getString(JsonObject obj, String key) {
		JsonElement e = obj.get(key);
		if (e == null || !e.isJsonPrimitive())
			return null;
		return e.getAsString();
	}

	private static String requireString(RawFragment fragment, JsonObject obj, String key) throws IOException {
		String value = getString(obj, key);
		if (value == null || value.isEmpty())
			throw new IOException(fragment.getSource() + ": missing " + key + " in " + obj);
		return value;
	}
}
