package org.modelform.dict;

/** Distinguishes the 2 kinds of {@link Definition} */
public enum DefinitionKind {
	/** A {@link ClassDefinition}: a type with members, which never has a value of its own */
	CLASS_DEFINITION,
	/** A {@link ComponentDefinition}: a declared member, which always participates in an instance path */
	INSTANTIABLE_COMPONENT
}
