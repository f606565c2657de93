package org.modelform.ast;

import java.io.IOException;
import java.io.Reader;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

/** An unflattened model AST document, as returned by a {@link TypeResolver} */
public final class RawFragment {
	private final String theSource;
	private final JsonObject theDocument;

	/**
	 * @param source A description of where the document came from, for diagnostics
	 * @param document The AST document
	 */
	public RawFragment(String source, JsonObject document) {
		theSource = source;
		theDocument = document;
	}

	/**
	 * @param source A description of where the document came from, for diagnostics
	 * @param reader The reader to read the JSON AST document from
	 * @return The fragment
	 * @throws IOException If the document cannot be read or is not a JSON object
	 */
	public static RawFragment read(String source, Reader reader) throws IOException {
		JsonElement json;
		try {
			json = JsonParser.parseReader(reader);
		} catch (JsonParseException e) {
			throw new IOException("Could not parse " + source, e);
		}
		if (!json.isJsonObject())
			throw new IOException(source + " is not a JSON object");
		return new RawFragment(source, json.getAsJsonObject());
	}

	/** @return A description of where the document came from */
	public String getSource() {
		return theSource;
	}

	/** @return The AST document */
	public JsonObject getDocument() {
		return theDocument;
	}

	@Override
	public String toString() {
		return theSource;
	}
}
