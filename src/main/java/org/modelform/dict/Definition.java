package org.modelform.dict;

import java.util.List;
import java.util.Objects;

/**
 * An entry in a {@link TypeDictionary}. Either a {@link ClassDefinition} or a {@link ComponentDefinition}; no other subclasses exist.
 */
public abstract class Definition {
	private final String thePath;
	private final String theDescription;

	Definition(String path, String description) {
		if (path == null || path.isEmpty())
			throw new IllegalArgumentException("A definition needs a path");
		thePath = path;
		theDescription = description;
	}

	/** @return The absolute dotted path of this definition, unique in its dictionary */
	public String getPath() {
		return thePath;
	}

	/** @return The last segment of this definition's path */
	public String getName() {
		return simpleName(thePath);
	}

	/** @return The label text for this definition, or null */
	public String getDescription() {
		return theDescription;
	}

	/** @return Which kind of definition this is */
	public abstract DefinitionKind getKind();

	/** @return The paths of this definition's children in the dictionary, in declaration order */
	public abstract List<String> getChildren();

	/**
	 * @param path A dotted path
	 * @return The last segment of the path
	 */
	public static String simpleName(String path) {
		int dot = path.lastIndexOf('.');
		return dot < 0 ? path : path.substring(dot + 1);
	}

	/**
	 * @param path A dotted path
	 * @return All segments but the last of the path, or the empty string for a single-segment path
	 */
	public static String parentPath(String path) {
		int dot = path.lastIndexOf('.');
		return dot < 0 ? "" : path.substring(0, dot);
	}

	/**
	 * @param parent The parent path, possibly empty
	 * @param name The name to append
	 * @return The dotted path of the name under the parent
	 */
	public static String childPath(String parent, String name) {
		return parent == null || parent.isEmpty() ? name : parent + "." + name;
	}

	@Override
	public int hashCode() {
		return thePath.hashCode();
	}

	@Override
	public boolean equals(Object obj) {
		if (obj == this)
			return true;
		else if (obj == null || obj.getClass() != getClass())
			return false;
		Definition other = (Definition) obj;
		return thePath.equals(other.thePath) && Objects.equals(theDescription, other.theDescription);
	}

	@Override
	public String toString() {
		return getKind() + " " + thePath;
	}
}
