package org.modelform.scope;

import java.io.IOException;
import java.io.Reader;
import java.util.LinkedHashMap;
import java.util.Map;

import org.modelform.expr.Values;

import com.google.common.collect.ImmutableMap;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

/** Externally supplied values by instance path, taking precedence over everything else during resolution. Immutable. */
public final class Selections {
	private static final Selections EMPTY = new Selections(ImmutableMap.of());

	private final ImmutableMap<String, Object> theValues;

	private Selections(ImmutableMap<String, Object> values) {
		theValues = values;
	}

	/** @return Selections with no values */
	public static Selections empty() {
		return EMPTY;
	}

	/**
	 * @param values The selected values by instance path
	 * @return Selections with the given values
	 * @throws IllegalArgumentException If any value is not a boolean, number or string
	 */
	public static Selections of(Map<String, ?> values) {
		if (values.isEmpty())
			return EMPTY;
		ImmutableMap.Builder<String, Object> builder = ImmutableMap.builder();
		for (Map.Entry<String, ?> entry : values.entrySet())
			builder.put(entry.getKey(), check(entry.getKey(), entry.getValue()));
		return new Selections(builder.build());
	}

	/**
	 * Reads selections from a flat JSON object of instance path to JSON primitive
	 *
	 * @param reader The reader to read the JSON from
	 * @return The selections
	 * @throws IOException If the document cannot be read or is not a flat object of primitives
	 */
	public static Selections read(Reader reader) throws IOException {
		JsonElement json;
		try {
			json = JsonParser.parseReader(reader);
		} catch (JsonParseException e) {
			throw new IOException("Could not parse selections", e);
		}
		if (json.isJsonNull())
			return EMPTY;
		else if (!json.isJsonObject())
			throw new IOException("Selections must be a JSON object, not " + json);
		JsonObject obj = json.getAsJsonObject();
		Map<String, Object> values = new LinkedHashMap<>();
		for (Map.Entry<String, JsonElement> entry : obj.entrySet()) {
			if (!entry.getValue().isJsonPrimitive())
				throw new IOException("Selection for " + entry.getKey() + " must be a boolean, number or string, not " + entry.getValue());
			values.put(entry.getKey(), Values.fromJson(entry.getValue()));
		}
		return of(values);
	}

	private static Object check(String path, Object value) {
		if (Values.kindOf(value) == null)
			throw new IllegalArgumentException("Selection for " + path + " must be a boolean, number or string, not " + value);
		return Values.normalize(value);
	}

	/**
	 * @param instancePath The instance path to select for
	 * @param value The value to select
	 * @return Selections with the same values as these, except the given value at the given path
	 */
	public Selections with(String instancePath, Object value) {
		Map<String, Object> values = new LinkedHashMap<>(theValues);
		values.put(instancePath, value);
		return of(values);
	}

	/**
	 * @param instancePath The instance path
	 * @return The selected value at the path, or null if nothing is selected there
	 */
	public Object get(String instancePath) {
		return theValues.get(instancePath);
	}

	/**
	 * @param instancePath The instance path
	 * @return Whether a value is selected at the path
	 */
	public boolean contains(String instancePath) {
		return theValues.containsKey(instancePath);
	}

	/** @return Whether nothing is selected */
	public boolean isEmpty() {
		return theValues.isEmpty();
	}

	/** @return The selected values by instance path */
	public Map<String, Object> asMap() {
		return theValues;
	}

	@Override
	public int hashCode() {
		return theValues.hashCode();
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof Selections && theValues.equals(((Selections) obj).theValues);
	}

	@Override
	public String toString() {
		return theValues.toString();
	}
}
