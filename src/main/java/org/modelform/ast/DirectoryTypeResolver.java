package org.modelform.ast;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import com.google.common.collect.ImmutableList;

/** A {@link LocatingTypeResolver} that searches an ordered list of directories. The first directory containing a match wins. */
public class DirectoryTypeResolver extends LocatingTypeResolver {
	private final List<Path> theRoots;

	/** @param roots The directories to search, in order */
	public DirectoryTypeResolver(List<Path> roots) {
		theRoots = ImmutableList.copyOf(roots);
	}

	/** @return The directories searched by this resolver, in order */
	public List<Path> getRoots() {
		return theRoots;
	}

	@Override
	protected int getLocationCount() {
		return theRoots.size();
	}

	@Override
	protected Reader open(int location, String relativePath) throws IOException {
		Path file = theRoots.get(location).resolve(relativePath);
		if (!Files.isRegularFile(file))
			return null;
		return Files.newBufferedReader(file, StandardCharsets.UTF_8);
	}

	@Override
	protected String describe(int location, String relativePath) {
		return theRoots.get(location).resolve(relativePath).toString();
	}
}
