package org.modelform.ast;

/** An <code>extends</code> clause: the base class reference and the modifications applied to inherited members */
public final class ExtendsDeclaration {
	private final String theBaseName;
	private final Modification theModification;

	/**
	 * @param baseName The reference to the base class, as written in source
	 * @param modification The modifications applied to the inherited members
	 */
	public ExtendsDeclaration(String baseName, Modification modification) {
		theBaseName = baseName;
		theModification = modification;
	}

	/** @return The reference to the base class, as written in source */
	public String getBaseName() {
		return theBaseName;
	}

	/** @return The modifications applied to the inherited members */
	public Modification getModification() {
		return theModification;
	}
}
