package org.modelform.dict;

import java.util.Collection;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

import com.google.common.collect.ImmutableSortedMap;

/**
 * A flat store of {@link Definition}s keyed by their absolute dotted path. Immutable once {@link Builder#build() built}, so a dictionary
 * may be shared by any number of concurrent resolutions.
 */
public final class TypeDictionary {
	private final ImmutableSortedMap<String, Definition> theDefinitions;

	private TypeDictionary(ImmutableSortedMap<String, Definition> definitions) {
		theDefinitions = definitions;
	}

	/**
	 * @param path The absolute dotted path of the definition
	 * @return The definition at the given path, or null if there is none
	 */
	public Definition get(String path) {
		return theDefinitions.get(path);
	}

	/**
	 * @param path The absolute dotted path of the definition
	 * @return Whether this dictionary contains a definition at the given path
	 */
	public boolean contains(String path) {
		return theDefinitions.containsKey(path);
	}

	/** @return All definitions in this dictionary, ordered by path */
	public Collection<Definition> getDefinitions() {
		return theDefinitions.values();
	}

	/** @return All definitions in this dictionary, keyed and ordered by path */
	public Map<String, Definition> asMap() {
		return theDefinitions;
	}

	/** @return The number of definitions in this dictionary */
	public int size() {
		return theDefinitions.size();
	}

	@Override
	public int hashCode() {
		return theDefinitions.hashCode();
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof TypeDictionary && theDefinitions.equals(((TypeDictionary) obj).theDefinitions);
	}

	@Override
	public String toString() {
		return "TypeDictionary" + theDefinitions.keySet();
	}

	/** @return A builder to populate a new dictionary */
	public static Builder build() {
		return new Builder();
	}

	/**
	 * Accumulates definitions for a dictionary. Insertion is first-writer-wins per path and safe for concurrent writers; the built
	 * dictionary's ordering depends only on the paths, never on insertion order.
	 */
	public static class Builder {
		private final ConcurrentHashMap<String, Definition> theDefinitions;

		Builder() {
			theDefinitions = new ConcurrentHashMap<>();
		}

		/**
		 * @param definition The definition to add
		 * @return The definition now stored at the definition's path: the given one, or the one that was already there
		 */
		public Definition add(Definition definition) {
			Definition existing = theDefinitions.putIfAbsent(definition.getPath(), definition);
			return existing != null ? existing : definition;
		}

		/**
		 * @param path The path to check
		 * @return Whether a definition has been added at the given path
		 */
		public boolean contains(String path) {
			return theDefinitions.containsKey(path);
		}

		/**
		 * @param path The path to get
		 * @return The definition that has been added at the given path, or null
		 */
		public Definition get(String path) {
			return theDefinitions.get(path);
		}

		/** @return The number of definitions added so far */
		public int size() {
			return theDefinitions.size();
		}

		/** @return A dictionary containing all definitions added to this builder */
		public TypeDictionary build() {
			return new TypeDictionary(ImmutableSortedMap.copyOf(new TreeMap<>(theDefinitions)));
		}
	}
}
