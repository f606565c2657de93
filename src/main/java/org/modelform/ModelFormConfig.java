package org.modelform;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.modelform.scope.ScopeResolver;

import com.google.common.collect.ImmutableList;
import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

/**
 * Settings for a {@link ModelForm}. Immutable; created with a {@link #build() builder}, or read from a JSON document:
 *
 * <pre>
 * { "nodeVisitBudget": 100000, "searchRoots": ["models", "/opt/library"], "evaluateEnable": true }
 * </pre>
 */
public final class ModelFormConfig {
	private static final Logger LOGGER = LogManager.getLogger(ModelFormConfig.class);

	/** The classpath resource {@link #load()} reads */
	public static final String RESOURCE = "modelform.json";

	/** The default settings */
	public static final ModelFormConfig DEFAULT = build().build();

	private final int theNodeVisitBudget;
	private final List<Path> theSearchRoots;
	private final boolean isEvaluatingEnable;

	private ModelFormConfig(int nodeVisitBudget, List<Path> searchRoots, boolean evaluateEnable) {
		theNodeVisitBudget = nodeVisitBudget;
		theSearchRoots = ImmutableList.copyOf(searchRoots);
		isEvaluatingEnable = evaluateEnable;
	}

	/** @return The maximum number of node visits in one resolution */
	public int getNodeVisitBudget() {
		return theNodeVisitBudget;
	}

	/** @return The directories to search for model documents, in order */
	public List<Path> getSearchRoots() {
		return theSearchRoots;
	}

	/** @return Whether enable conditions are evaluated when generating schemas, as opposed to left as expressions */
	public boolean isEvaluatingEnable() {
		return isEvaluatingEnable;
	}

	/** @return A builder initialized with these settings */
	public Builder copy() {
		return new Builder().withNodeVisitBudget(theNodeVisitBudget).withSearchRoots(theSearchRoots).evaluateEnable(isEvaluatingEnable);
	}

	@Override
	public String toString() {
		return "budget=" + theNodeVisitBudget + ", roots=" + theSearchRoots + ", evaluateEnable=" + isEvaluatingEnable;
	}

	/** @return A builder for settings, initialized with the defaults */
	public static Builder build() {
		return new Builder();
	}

	/**
	 * Reads settings from a JSON object. Keys that are absent keep their default values.
	 *
	 * @param reader The reader to read the JSON from
	 * @return The settings
	 * @throws IOException If the document cannot be read or has bad values
	 */
	public static ModelFormConfig read(Reader reader) throws IOException {
		JsonElement json;
		try {
			json = JsonParser.parseReader(reader);
		} catch (JsonParseException e) {
			throw new IOException("Could not parse configuration", e);
		}
		if (!json.isJsonObject())
			throw new IOException("Configuration must be a JSON object");
		Builder builder = build();
		try {
			for (Map.Entry<String, JsonElement> entry : json.getAsJsonObject().entrySet()) {
				switch (entry.getKey()) {
				case "nodeVisitBudget":
					builder.withNodeVisitBudget(entry.getValue().getAsInt());
					break;
				case "searchRoots":
					List<Path> roots = new ArrayList<>();
					for (JsonElement root : entry.getValue().getAsJsonArray())
						roots.add(Paths.get(root.getAsString()));
					builder.withSearchRoots(roots);
					break;
				case "evaluateEnable":
					builder.evaluateEnable(entry.getValue().getAsBoolean());
					break;
				default:
					LOGGER.warn("Unrecognized configuration key {}", entry.getKey());
				}
			}
		} catch (IllegalStateException | UnsupportedOperationException | IllegalArgumentException e) {
			throw new IOException("Bad configuration value: " + e.getMessage(), e);
		}
		return builder.build();
	}

	/**
	 * @return The settings in the {@value #RESOURCE} classpath resource, or the {@link #DEFAULT defaults} if there is no such resource
	 * @throws IOException If the resource cannot be read or has bad values
	 */
	public static ModelFormConfig load() throws IOException {
		ClassLoader loader = Thread.currentThread().getContextClassLoader();
		if (loader == null)
			loader = ModelFormConfig.class.getClassLoader();
		try (InputStream in = loader.getResourceAsStream(RESOURCE)) {
			if (in == null) {
				LOGGER.debug("No {} found, using default configuration", RESOURCE);
				return DEFAULT;
			}
			ModelFormConfig config = read(new InputStreamReader(in, StandardCharsets.UTF_8));
			LOGGER.debug("Loaded configuration {}", config);
			return config;
		}
	}

	/** Builds {@link ModelFormConfig}s */
	public static class Builder {
		private int theNodeVisitBudget;
		private final List<Path> theSearchRoots;
		private boolean isEvaluatingEnable;

		Builder() {
			theNodeVisitBudget = ScopeResolver.DEFAULT_NODE_VISIT_BUDGET;
			theSearchRoots = new ArrayList<>();
			isEvaluatingEnable = true;
		}

		/**
		 * @param budget The maximum number of node visits in one resolution
		 * @return This builder
		 * @throws IllegalArgumentException If the budget is not positive
		 */
		public Builder withNodeVisitBudget(int budget) {
			if (budget <= 0)
				throw new IllegalArgumentException("nodeVisitBudget must be positive, not " + budget);
			theNodeVisitBudget = budget;
			return this;
		}

		/**
		 * @param roots The directories to search for model documents, in order, replacing any previously set
		 * @return This builder
		 */
		public Builder withSearchRoots(List<Path> roots) {
			theSearchRoots.clear();
			theSearchRoots.addAll(roots);
			return this;
		}

		/**
		 * @param root A directory to search for model documents after those already added
		 * @return This builder
		 */
		public Builder withSearchRoot(Path root) {
			theSearchRoots.add(root);
			return this;
		}

		/**
		 * @param evaluate Whether enable conditions are evaluated when generating schemas
		 * @return This builder
		 */
		public Builder evaluateEnable(boolean evaluate) {
			isEvaluatingEnable = evaluate;
			return this;
		}

		/** @return The settings */
		public ModelFormConfig build() {
			return new ModelFormConfig(theNodeVisitBudget, theSearchRoots, isEvaluatingEnable);
		}
	}
}
