package org.modelform.ast;

import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * A {@link TypeResolver} that maps type references to JSON documents in some hierarchical store. <code>A.B.C</code> is looked for as
 * <code>A/B/C.json</code>, then as a class nested in <code>A/B.json</code>, and so on up the path.
 */
public abstract class LocatingTypeResolver implements TypeResolver {
	private static final Logger LOGGER = LogManager.getLogger(LocatingTypeResolver.class);

	/** The file extension of AST documents */
	public static final String EXTENSION = ".json";

	@Override
	public RawFragment resolve(String typeReference) throws IOException {
		List<String> candidates = getCandidates(typeReference);
		// Each location gets the full candidate list before the next location is consulted
		for (int location = 0; location < getLocationCount(); location++) {
			for (String candidate : candidates) {
				Reader reader = open(location, candidate);
				if (reader == null)
					continue;
				String source = describe(location, candidate);
				LOGGER.debug("Resolved {} to {}", typeReference, source);
				try (Reader r = reader) {
					return RawFragment.read(source, r);
				}
			}
		}
		return null;
	}

	/** @return The number of separate locations this resolver searches, in order */
	protected int getLocationCount() {
		return 1;
	}

	/**
	 * @param typeReference The dotted type reference
	 * @return The relative, '/'-separated document paths that may define the type, most specific first
	 */
	public static List<String> getCandidates(String typeReference) {
		List<String> candidates = new ArrayList<>();
		String path = typeReference.replace('.', '/');
		while (!path.isEmpty()) {
			candidates.add(path + EXTENSION);
			int slash = path.lastIndexOf('/');
			path = slash < 0 ? "" : path.substring(0, slash);
		}
		return candidates;
	}

	/**
	 * @param location The index of the location to look in
	 * @param relativePath The '/'-separated document path
	 * @return A reader for the document, or null if it does not exist
	 * @throws IOException If the document exists but cannot be opened
	 */
	protected abstract Reader open(int location, String relativePath) throws IOException;

	/**
	 * @param location The index of the location the document is in
	 * @param relativePath The '/'-separated document path
	 * @return A description of the document's location, for diagnostics
	 */
	protected abstract String describe(int location, String relativePath);
}
