package org.modelform.ast;

import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;

/** A {@link LocatingTypeResolver} that finds AST documents as class loader resources under a common prefix */
public class ClasspathTypeResolver extends LocatingTypeResolver {
	private final ClassLoader theClassLoader;
	private final String thePrefix;

	/**
	 * @param classLoader The class loader to load resources from
	 * @param prefix The resource path prefix under which type documents are found, e.g. "models"
	 */
	public ClasspathTypeResolver(ClassLoader classLoader, String prefix) {
		theClassLoader = classLoader;
		String p = prefix == null ? "" : prefix;
		while (p.startsWith("/"))
			p = p.substring(1);
		if (!p.isEmpty() && !p.endsWith("/"))
			p += "/";
		thePrefix = p;
	}

	@Override
	protected Reader open(int location, String relativePath) {
		InputStream stream = theClassLoader.getResourceAsStream(thePrefix + relativePath);
		return stream == null ? null : new InputStreamReader(stream, StandardCharsets.UTF_8);
	}

	@Override
	protected String describe(int location, String relativePath) {
		return "classpath:" + thePrefix + relativePath;
	}
}
