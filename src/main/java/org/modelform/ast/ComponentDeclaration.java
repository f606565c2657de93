package org.modelform.ast;

import com.google.gson.JsonElement;

/** A component declaration from a class's element list */
public final class ComponentDeclaration {
	private final String theIdentifier;
	private final String theTypeSpecifier;
	private final Modification theModification;
	private final String theDescription;
	private final JsonElement theEnable;

	/**
	 * @param identifier The component's name
	 * @param typeSpecifier The component's type, as written in source
	 * @param modification The component's value assignment and member overrides
	 * @param description The component's description string, or null
	 * @param enable The raw JSON of the component's <code>enable</code> annotation, or null if it has none
	 */
	public ComponentDeclaration(String identifier, String typeSpecifier, Modification modification, String description,
		JsonElement enable) {
		theIdentifier = identifier;
		theTypeSpecifier = typeSpecifier;
		theModification = modification;
		theDescription = description;
		theEnable = enable;
	}

	/** @return The component's name */
	public String getIdentifier() {
		return theIdentifier;
	}

	/** @return The component's type, as written in source */
	public String getTypeSpecifier() {
		return theTypeSpecifier;
	}

	/** @return The component's value assignment and member overrides */
	public Modification getModification() {
		return theModification;
	}

	/** @return The component's description string, or null */
	public String getDescription() {
		return theDescription;
	}

	/** @return The raw JSON of the component's <code>enable</code> annotation, or null if it has none */
	public JsonElement getEnable() {
		return theEnable;
	}

	@Override
	public String toString() {
		return theTypeSpecifier + " " + theIdentifier;
	}
}
