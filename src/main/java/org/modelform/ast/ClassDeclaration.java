package org.modelform.ast;

import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * A class definition from the model source. Either a long class definition with a composition of elements, or a short one that
 * aliases another type (<code>type Temp = Real</code>).
 */
public final class ClassDeclaration {
	private final String theIdentifier;
	private final String thePrefix;
	private final String theDescription;
	private final String theAliasOf;
	private final List<ComponentDeclaration> theComponents;
	private final List<ExtendsDeclaration> theExtends;
	private final List<ClassDeclaration> theNestedClasses;

	/**
	 * @param identifier The class's name
	 * @param prefix The class prefix (model, block, record, type, ...)
	 * @param description The class's description string, or null
	 * @param aliasOf The type this class aliases, or null for a long class definition
	 * @param components The class's own component declarations, in source order
	 * @param extendsClauses The class's extends clauses, in source order
	 * @param nestedClasses The classes defined inside this class
	 */
	public ClassDeclaration(String identifier, String prefix, String description, String aliasOf, List<ComponentDeclaration> components,
		List<ExtendsDeclaration> extendsClauses, List<ClassDeclaration> nestedClasses) {
		theIdentifier = identifier;
		thePrefix = prefix;
		theDescription = description;
		theAliasOf = aliasOf;
		theComponents = ImmutableList.copyOf(components);
		theExtends = ImmutableList.copyOf(extendsClauses);
		theNestedClasses = ImmutableList.copyOf(nestedClasses);
	}

	/** @return The class's name */
	public String getIdentifier() {
		return theIdentifier;
	}

	/** @return The class prefix (model, block, record, type, ...) */
	public String getPrefix() {
		return thePrefix;
	}

	/** @return The class's description string, or null */
	public String getDescription() {
		return theDescription;
	}

	/** @return The type this class aliases, or null for a long class definition */
	public String getAliasOf() {
		return theAliasOf;
	}

	/** @return The class's own component declarations, in source order */
	public List<ComponentDeclaration> getComponents() {
		return theComponents;
	}

	/** @return The class's extends clauses, in source order */
	public List<ExtendsDeclaration> getExtends() {
		return theExtends;
	}

	/** @return The classes defined inside this class */
	public List<ClassDeclaration> getNestedClasses() {
		return theNestedClasses;
	}

	@Override
	public String toString() {
		return thePrefix + " " + theIdentifier;
	}
}
