package org.modelform.tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.modelform.CyclicDefinitionException;
import org.modelform.DanglingReferenceException;
import org.modelform.ModelLoadException;
import org.modelform.TypeNotFoundException;
import org.modelform.dict.ClassDefinition;
import org.modelform.dict.ComponentDefinition;
import org.modelform.dict.Definition;
import org.modelform.dict.TypeDictionary;
import org.modelform.expr.Expression;

/**
 * Validates the structure of a {@link TypeDictionary} under a root class and builds the {@link InstanceTree} of the root's
 * instances.
 * <p>
 * Class definitions never contribute a segment to instance paths: the members of a class are instantiated directly under the
 * component that instantiates it. Overrides supplied at an instantiation site are threaded down to the instances they target; where
 * several enclosing sites supply a value for the same instance, the outermost one wins.
 * </p>
 */
public class TreeBuilder {
	private static final Logger LOGGER = LogManager.getLogger(TreeBuilder.class);

	private TreeBuilder() {
	}

	/**
	 * Validates the dictionary under the root class, then builds its instance tree
	 *
	 * @param rootType The dictionary path of the root class
	 * @param dictionary The completed dictionary
	 * @return The instance tree of the root class
	 * @throws ModelLoadException If the root is not a class in the dictionary, if any reachable child reference does not resolve, or if
	 *         class composition is cyclic
	 */
	public static InstanceTree build(String rootType, TypeDictionary dictionary) throws ModelLoadException {
		Definition root = dictionary.get(rootType);
		if (!(root instanceof ClassDefinition))
			throw new TypeNotFoundException(rootType, null);
		validate(rootType, dictionary);
		List<InstanceNode> members = instantiateMembers(root, "", Collections.<String, InstanceOverride> emptyMap(), dictionary);
		InstanceTree tree = new InstanceTree(rootType, dictionary, new InstanceNode("", root, null, Collections.emptyMap(), members));
		LOGGER.debug("Built instance tree of {} with {} nodes", rootType, tree.size());
		return tree;
	}

	/**
	 * Checks that every child reference reachable from a definition resolves and that no definition is reachable from itself
	 *
	 * @param rootPath The dictionary path of the definition to validate from
	 * @param dictionary The dictionary to validate
	 * @throws ModelLoadException If the root or a child reference does not resolve, or if definitions refer to themselves transitively
	 */
	public static void validate(String rootPath, TypeDictionary dictionary) throws ModelLoadException {
		if (!dictionary.contains(rootPath))
			throw new TypeNotFoundException(rootPath, null);
		validate(rootPath, dictionary, new LinkedHashSet<>(), new HashSet<>());
	}

	private static void validate(String path, TypeDictionary dictionary, LinkedHashSet<String> chain, Set<String> finished)
		throws ModelLoadException {
		if (finished.contains(path))
			return;
		if (!chain.add(path)) {
			List<String> cycle = new ArrayList<>();
			boolean inCycle = false;
			for (String p : chain) {
				if (p.equals(path))
					inCycle = true;
				if (inCycle)
					cycle.add(p);
			}
			cycle.add(path);
			throw new CyclicDefinitionException(cycle);
		}
		for (String child : dictionary.get(path).getChildren()) {
			if (!dictionary.contains(child))
				throw new DanglingReferenceException(path, child);
			validate(child, dictionary, chain, finished);
		}
		chain.remove(path);
		finished.add(path);
	}

	private static List<InstanceNode> instantiateMembers(Definition type, String instancePath, Map<String, InstanceOverride> overrides,
		TypeDictionary dictionary) {
		List<InstanceNode> nodes = new ArrayList<>();
		for (String childPath : type.getChildren()) {
			Definition child = dictionary.get(childPath);
			if (child instanceof ComponentDefinition)
				nodes.add(instantiate((ComponentDefinition) child, instancePath, overrides, dictionary));
			else
				nodes.addAll(instantiateMembers(child, instancePath, overrides, dictionary));
		}
		return nodes;
	}

	private static InstanceNode instantiate(ComponentDefinition component, String enclosingPath, Map<String, InstanceOverride> overrides,
		TypeDictionary dictionary) {
		String name = component.getName();
		String path = Definition.childPath(enclosingPath, name);
		Map<String, InstanceOverride> memberOverrides = new LinkedHashMap<>();
		for (Map.Entry<String, Expression> own : component.getOverrides().entrySet())
			memberOverrides.put(own.getKey(), new InstanceOverride(own.getValue(), enclosingPath));
		// Overrides from further out replace those supplied here
		String prefix = name + ".";
		for (Map.Entry<String, InstanceOverride> outer : overrides.entrySet()) {
			if (outer.getKey().startsWith(prefix))
				memberOverrides.put(outer.getKey().substring(prefix.length()), outer.getValue());
		}
		List<InstanceNode> children = new ArrayList<>();
		for (String classPath : component.getChildren())
			children.addAll(instantiateMembers(dictionary.get(classPath), path, memberOverrides, dictionary));
		return new InstanceNode(path, component, overrides.get(name), memberOverrides, children);
	}
}
