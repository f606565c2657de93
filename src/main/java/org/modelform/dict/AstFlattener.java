package org.modelform.dict;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.modelform.CyclicDefinitionException;
import org.modelform.Diagnostics;
import org.modelform.ErrorKind;
import org.modelform.ModelLoadException;
import org.modelform.TypeNotFoundException;
import org.modelform.ast.AstReader;
import org.modelform.ast.ClassDeclaration;
import org.modelform.ast.ComponentDeclaration;
import org.modelform.ast.ExtendsDeclaration;
import org.modelform.ast.ModelDocument;
import org.modelform.ast.RawFragment;
import org.modelform.ast.TypeResolver;
import org.modelform.expr.Expression;
import org.modelform.expr.ExpressionParseException;
import org.modelform.expr.JsonExpressionReader;
import org.modelform.expr.Literal;

import com.google.gson.JsonElement;

/**
 * Walks model AST documents depth-first and emits flat {@link Definition}s into a {@link TypeDictionary}. Type references are resolved
 * through a {@link TypeResolver}, and inherited members are copied into each derived class as it is flattened.
 * <p>
 * Flattening is memoized per type path. A flattener is a single-writer: it is not safe to use from multiple threads.
 * </p>
 */
public class AstFlattener {
	private static final Logger LOGGER = LogManager.getLogger(AstFlattener.class);

	private final TypeResolver theResolver;
	private final JsonExpressionReader theExpressions;
	private final Diagnostics theDiagnostics;
	private final TypeDictionary.Builder theDictionary;
	/** Class declarations read from source, by absolute path, not necessarily flattened yet */
	private final Map<String, ClassDeclaration> theDeclarations;
	/** Flattened short class definitions, by absolute path */
	private final Map<String, DataType> theAliases;
	private final Set<String> theReadSources;
	/** Classes currently being flattened, in order, for inheritance cycle detection */
	private final LinkedHashSet<String> theInProgress;

	/**
	 * @param resolver The resolver to find the source of referenced types
	 * @param expressions The reader for value and annotation expressions
	 * @param diagnostics The record to report recovered problems to
	 */
	public AstFlattener(TypeResolver resolver, JsonExpressionReader expressions, Diagnostics diagnostics) {
		theResolver = resolver;
		theExpressions = expressions;
		theDiagnostics = diagnostics;
		theDictionary = TypeDictionary.build();
		theDeclarations = new HashMap<>();
		theAliases = new HashMap<>();
		theReadSources = new HashSet<>();
		theInProgress = new LinkedHashSet<>();
	}

	/**
	 * Makes the classes of a document known to this flattener without flattening them. Classes already known at the same path are kept.
	 *
	 * @param fragment The AST fragment to read
	 * @throws TypeNotFoundException If the fragment does not follow the AST structure
	 */
	public void addSource(RawFragment fragment) throws TypeNotFoundException {
		ModelDocument doc;
		try {
			doc = AstReader.read(fragment);
		} catch (IOException e) {
			throw new TypeNotFoundException(fragment.getSource(), null, e);
		}
		addSource(doc);
	}

	/**
	 * Makes the classes of a document known to this flattener without flattening them. Classes already known at the same path are kept.
	 *
	 * @param doc The AST document to add
	 */
	public void addSource(ModelDocument doc) {
		if (!theReadSources.add(doc.getSource()))
			return;
		for (ClassDeclaration classDecl : doc.getClasses())
			declare(doc.getWithin(), classDecl);
	}

	private void declare(String parentPath, ClassDeclaration classDecl) {
		String path = Definition.childPath(parentPath, classDecl.getIdentifier());
		theDeclarations.putIfAbsent(path, classDecl);
		for (ClassDeclaration nested : classDecl.getNestedClasses())
			declare(path, nested);
	}

	/**
	 * Flattens a type and everything it depends on into this flattener's dictionary. Flattening a type that has already been flattened
	 * does nothing.
	 *
	 * @param typeReference The absolute dotted path of the type to flatten
	 * @return The type
	 * @throws ModelLoadException If the type or anything it depends on cannot be found, or if inheritance is cyclic
	 */
	public DataType flattenType(String typeReference) throws ModelLoadException {
		return resolveType(typeReference, "");
	}

	/** @return A dictionary of all definitions flattened so far */
	public TypeDictionary getDictionary() {
		return theDictionary.build();
	}

	/** @return The number of definitions flattened so far */
	public int size() {
		return theDictionary.size();
	}

	/**
	 * Resolves a type reference as seen from inside a class. Inside <code>P.Q.C</code>, <code>ref</code> is tried as
	 * <code>P.Q.C.ref</code>, <code>P.Q.ref</code>, <code>P.ref</code> and <code>ref</code>; the first match wins.
	 *
	 * @param reference The type reference as written in source
	 * @param fromPath The path of the class containing the reference, or the empty string for the top level
	 * @return The flattened type
	 * @throws ModelLoadException If the type cannot be found or flattened
	 */
	DataType resolveType(String reference, String fromPath) throws ModelLoadException {
		DataType.Primitive prim = DataType.Primitive.forName(reference);
		if (prim != null)
			return prim;
		List<String> candidates = new ArrayList<>();
		for (String scope = fromPath; !scope.isEmpty(); scope = Definition.parentPath(scope))
			candidates.add(Definition.childPath(scope, reference));
		candidates.add(reference);
		for (String candidate : candidates) {
			if (isKnown(candidate))
				return flattenKnown(candidate, fromPath);
		}
		for (String candidate : candidates) {
			RawFragment fragment;
			try {
				fragment = theResolver.resolve(candidate);
			} catch (IOException e) {
				throw new TypeNotFoundException(reference, fromPath.isEmpty() ? null : fromPath, e);
			}
			if (fragment == null)
				continue;
			addSource(fragment);
			if (isKnown(candidate))
				return flattenKnown(candidate, fromPath);
		}
		throw new TypeNotFoundException(reference, fromPath.isEmpty() ? null : fromPath);
	}

	private boolean isKnown(String path) {
		return theDictionary.contains(path) || theAliases.containsKey(path) || theDeclarations.containsKey(path);
	}

	private DataType flattenKnown(String path, String fromPath) throws ModelLoadException {
		DataType alias = theAliases.get(path);
		if (alias != null)
			return alias;
		if (theDictionary.contains(path) || theInProgress.contains(path))
			return new DataType.ClassReference(path); // Already flattened, or composition recursion left to the tree builder
		ClassDeclaration decl = theDeclarations.get(path);
		if (decl.getAliasOf() != null)
			return flattenAlias(path, decl);
		flattenClass(path, decl);
		return new DataType.ClassReference(path);
	}

	private DataType flattenAlias(String path, ClassDeclaration decl) throws ModelLoadException {
		if (!theInProgress.add(path))
			throw cycle(path);
		try {
			DataType type = resolveType(decl.getAliasOf(), Definition.parentPath(path));
			theAliases.put(path, type);
			return type;
		} finally {
			theInProgress.remove(path);
		}
	}

	private void flattenClass(String path, ClassDeclaration decl) throws ModelLoadException {
		theInProgress.add(path);
		try {
			LOGGER.debug("Flattening {} {}", decl.getPrefix(), path);
			Set<String> ownNames = new HashSet<>();
			for (ComponentDeclaration comp : decl.getComponents())
				ownNames.add(comp.getIdentifier());

			Map<String, ComponentDefinition> members = new LinkedHashMap<>();
			List<String> baseClasses = new ArrayList<>();
			for (ExtendsDeclaration ext : decl.getExtends()) {
				String basePath = resolveBase(ext.getBaseName(), path);
				baseClasses.add(basePath);
				inherit(path, (ClassDefinition) theDictionary.get(basePath), ext, ownNames, members);
			}
			for (ComponentDeclaration comp : decl.getComponents())
				members.put(comp.getIdentifier(), flattenComponent(path, comp));

			for (ComponentDefinition member : members.values())
				theDictionary.add(member);
			theDictionary.add(
				new ClassDefinition(path, decl.getPrefix(), decl.getDescription(), new ArrayList<>(pathsOf(members)), baseClasses));
		} finally {
			theInProgress.remove(path);
		}
	}

	private String resolveBase(String baseName, String path) throws ModelLoadException {
		DataType base = resolveType(baseName, path);
		if (!(base instanceof DataType.ClassReference))
			throw new TypeNotFoundException(baseName, path);
		String basePath = ((DataType.ClassReference) base).getPath();
		if (theInProgress.contains(basePath))
			throw cycle(basePath);
		return basePath;
	}

	private void inherit(String path, ClassDefinition base, ExtendsDeclaration ext, Set<String> ownNames,
		Map<String, ComponentDefinition> members) {
		Map<String, JsonElement> modifications = ext.getModification().flattenArguments();
		for (String childPath : base.getChildren()) {
			Definition child = theDictionary.get(childPath);
			if (!(child instanceof ComponentDefinition))
				continue;
			String name = child.getName();
			// Members declared in the derived class shadow inherited ones; the first base to supply a name wins
			if (ownNames.contains(name) || members.containsKey(name))
				continue;
			String memberPath = Definition.childPath(path, name);
			ComponentDefinition member = ((ComponentDefinition) child).atPath(memberPath);
			Expression value = null;
			Map<String, Expression> overrides = new LinkedHashMap<>();
			for (Map.Entry<String, JsonElement> mod : modifications.entrySet()) {
				if (mod.getKey().equals(name))
					value = parseValue(mod.getValue(), memberPath, "extends modification");
				else if (mod.getKey().startsWith(name + ".")) {
					Expression override = parseValue(mod.getValue(), memberPath, "extends modification");
					if (override != null)
						overrides.put(mod.getKey().substring(name.length() + 1), override);
				}
			}
			if (value != null || !overrides.isEmpty())
				member = member.modified(value, overrides);
			members.put(name, member);
		}
	}

	private ComponentDefinition flattenComponent(String classPath, ComponentDeclaration comp) throws ModelLoadException {
		String path = Definition.childPath(classPath, comp.getIdentifier());
		DataType type = resolveType(comp.getTypeSpecifier(), classPath);
		Expression declared = null;
		if (comp.getModification().getValue() != null)
			declared = parseValue(comp.getModification().getValue(), path, "value");
		Map<String, Expression> overrides = new LinkedHashMap<>();
		// Arguments of a primitive component are attributes (start, min, ...) rather than member overrides
		if (!type.isPrimitive()) {
			for (Map.Entry<String, JsonElement> mod : comp.getModification().flattenArguments().entrySet()) {
				Expression override = parseValue(mod.getValue(), Definition.childPath(path, mod.getKey()), "override");
				if (override != null)
					overrides.put(mod.getKey(), override);
			}
		}
		Expression enable = Literal.TRUE;
		if (comp.getEnable() != null)
			enable = parseEnable(comp.getEnable(), path);
		return new ComponentDefinition(path, type, declared, comp.getDescription(), enable, overrides);
	}

	private Expression parseEnable(JsonElement json, String path) {
		try {
			return theExpressions.read(json);
		} catch (ExpressionParseException e) {
			theDiagnostics.warn(ErrorKind.MALFORMED_ANNOTATION, path, "Enable annotation could not be parsed, using true: " + e.getMessage());
			return Literal.TRUE;
		}
	}

	private Expression parseValue(JsonElement json, String path, String what) {
		try {
			return theExpressions.read(json);
		} catch (ExpressionParseException e) {
			theDiagnostics.warn(ErrorKind.MALFORMED_ANNOTATION, path, "Declared " + what + " could not be parsed, ignoring it: " + e.getMessage());
			return null;
		}
	}

	private CyclicDefinitionException cycle(String repeated) {
		List<String> chain = new ArrayList<>();
		boolean inCycle = false;
		for (String p : theInProgress) {
			if (p.equals(repeated))
				inCycle = true;
			if (inCycle)
				chain.add(p);
		}
		chain.add(repeated);
		return new CyclicDefinitionException(chain);
	}

	private static List<String> pathsOf(Map<String, ComponentDefinition> members) {
		List<String> paths = new ArrayList<>(members.size());
		for (ComponentDefinition member : members.values())
			paths.add(member.getPath());
		return paths;
	}
}
