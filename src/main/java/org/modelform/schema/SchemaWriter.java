package org.modelform.schema;

import java.io.IOException;
import java.io.Writer;

import org.modelform.expr.Values;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonIOException;
import com.google.gson.JsonObject;

/**
 * Serializes {@link FormSchema}s to JSON for a UI renderer:
 *
 * <pre>
 * { "rootType": "TestModel", "description": "...",
 *   "nodes": [ { "path": "hello", "type": "String", "value": "World", "enable": true, "description": "...", "childNodes": [] } ] }
 * </pre>
 */
public class SchemaWriter {
	private final Gson theGson;

	/** @param prettyPrint Whether to indent the output */
	public SchemaWriter(boolean prettyPrint) {
		GsonBuilder builder = new GsonBuilder().serializeNulls().disableHtmlEscaping();
		if (prettyPrint)
			builder.setPrettyPrinting();
		theGson = builder.create();
	}

	/** Creates a writer producing indented output */
	public SchemaWriter() {
		this(true);
	}

	/**
	 * @param schema The schema to convert
	 * @return The JSON form of the schema
	 */
	public JsonObject toJson(FormSchema schema) {
		JsonObject json = new JsonObject();
		json.addProperty("rootType", schema.getRootType());
		if (schema.getDescription() != null)
			json.addProperty("description", schema.getDescription());
		json.add("nodes", toJson(schema.getNodes()));
		return json;
	}

	private JsonArray toJson(Iterable<SchemaNode> nodes) {
		JsonArray array = new JsonArray();
		for (SchemaNode node : nodes) {
			JsonObject json = new JsonObject();
			json.addProperty("path", node.getPath());
			json.addProperty("type", node.getType());
			json.add("value", Values.toJson(node.getValue()));
			json.add("enable", Values.toJson(node.getEnable()));
			if (node.getDescription() != null)
				json.addProperty("description", node.getDescription());
			json.add("childNodes", toJson(node.getChildNodes()));
			array.add(json);
		}
		return array;
	}

	/**
	 * @param schema The schema to write
	 * @param writer The writer to write the JSON to
	 * @throws IOException If the writer throws an exception
	 */
	public void write(FormSchema schema, Writer writer) throws IOException {
		try {
			theGson.toJson(toJson(schema), writer);
		} catch (JsonIOException e) {
			throw e.getCause() instanceof IOException ? (IOException) e.getCause() : new IOException(e);
		}
		writer.flush();
	}

	/**
	 * @param schema The schema to print
	 * @return The JSON text of the schema
	 */
	public String toString(FormSchema schema) {
		return theGson.toJson(toJson(schema));
	}
}
