package org.modelform.ast;

import java.util.List;

import com.google.common.collect.ImmutableList;

/** A read AST document: the package the document is within and the classes it defines */
public final class ModelDocument {
	private final String theSource;
	private final String theWithin;
	private final List<ClassDeclaration> theClasses;

	/**
	 * @param source A description of where the document came from
	 * @param within The dotted package path the classes are defined in, or the empty string for the top level
	 * @param classes The classes defined in the document
	 */
	public ModelDocument(String source, String within, List<ClassDeclaration> classes) {
		theSource = source;
		theWithin = within == null ? "" : within;
		theClasses = ImmutableList.copyOf(classes);
	}

	/** @return A description of where the document came from */
	public String getSource() {
		return theSource;
	}

	/** @return The dotted package path the classes are defined in, or the empty string for the top level */
	public String getWithin() {
		return theWithin;
	}

	/** @return The classes defined in the document */
	public List<ClassDeclaration> getClasses() {
		return theClasses;
	}

	@Override
	public String toString() {
		return theSource;
	}
}
