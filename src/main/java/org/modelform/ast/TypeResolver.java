package org.modelform.ast;

import java.io.IOException;

/**
 * Locates the source of a type reference. A dotted reference <code>A.B.C</code> is looked up by treating <code>A.B</code> as a nested
 * path and <code>C</code> as the defining unit.
 */
public interface TypeResolver {
	/**
	 * @param typeReference The absolute dotted path of the type
	 * @return The AST fragment defining the type, or null if this resolver cannot find it
	 * @throws IOException If the fragment exists but cannot be read
	 */
	RawFragment resolve(String typeReference) throws IOException;

	/** A resolver that never finds anything */
	TypeResolver NONE = typeReference -> null;
}
