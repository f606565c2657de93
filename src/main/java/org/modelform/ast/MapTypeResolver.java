package org.modelform.ast;

import java.util.LinkedHashMap;
import java.util.Map;

/** A {@link TypeResolver} backed by fragments registered in memory */
public class MapTypeResolver implements TypeResolver {
	private final Map<String, RawFragment> theFragments;

	/** Creates an empty resolver */
	public MapTypeResolver() {
		theFragments = new LinkedHashMap<>();
	}

	/**
	 * @param typeReference The absolute dotted path of the type
	 * @param fragment The fragment defining the type
	 * @return This resolver
	 */
	public MapTypeResolver with(String typeReference, RawFragment fragment) {
		synchronized (theFragments) {
			theFragments.put(typeReference, fragment);
		}
		return this;
	}

	@Override
	public RawFragment resolve(String typeReference) {
		synchronized (theFragments) {
			return theFragments.get(typeReference);
		}
	}
}
