package org.modelform.ast;

import java.util.LinkedHashMap;
import java.util.Map;

import com.google.common.collect.ImmutableMap;
import com.google.gson.JsonElement;

/**
 * A modification from the model source: an optional value assignment (<code>= expr</code>) and optional nested arguments
 * (<code>(x = 1, inner(y = 2))</code>)
 */
public final class Modification {
	/** A modification that assigns nothing */
	public static final Modification NONE = new Modification(null, ImmutableMap.of());

	private final JsonElement theValue;
	private final Map<String, Modification> theArguments;

	/**
	 * @param value The raw JSON expression assigned by this modification, or null
	 * @param arguments The nested modifications, keyed by their (possibly dotted) names, in source order
	 */
	public Modification(JsonElement value, Map<String, Modification> arguments) {
		theValue = value;
		theArguments = ImmutableMap.copyOf(arguments);
	}

	/** @return The raw JSON expression assigned by this modification, or null */
	public JsonElement getValue() {
		return theValue;
	}

	/** @return The nested modifications, keyed by their (possibly dotted) names, in source order */
	public Map<String, Modification> getArguments() {
		return theArguments;
	}

	/**
	 * Flattens the nested arguments so that <code>inner(y = 2)</code> and <code>inner.y = 2</code> both become the entry
	 * <code>inner.y &rarr; 2</code>. Later arguments replace earlier ones for the same path.
	 *
	 * @return The value assignments of all nested arguments, keyed by dotted path relative to this modification
	 */
	public Map<String, JsonElement> flattenArguments() {
		Map<String, JsonElement> flat = new LinkedHashMap<>();
		flatten("", flat);
		return flat;
	}

	private void flatten(String prefix, Map<String, JsonElement> flat) {
		for (Map.Entry<String, Modification> arg : theArguments.entrySet()) {
			String path = prefix + arg.getKey();
			if (arg.getValue().getValue() != null) {
				flat.remove(path); // Keep the latest assignment's position
				flat.put(path, arg.getValue().getValue());
			}
			arg.getValue().flatten(path + ".", flat);
		}
	}
}
