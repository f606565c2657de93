package org.modelform;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.modelform.ast.CompositeTypeResolver;
import org.modelform.ast.DirectoryTypeResolver;
import org.modelform.ast.RawFragment;
import org.modelform.ast.TypeResolver;
import org.modelform.dict.AstFlattener;
import org.modelform.dict.DataType;
import org.modelform.dict.TypeDictionary;
import org.modelform.expr.AntlrExpressionParser;
import org.modelform.expr.ExpressionEvaluator;
import org.modelform.expr.ExpressionParser;
import org.modelform.expr.JsonExpressionReader;
import org.modelform.tree.InstanceTree;
import org.modelform.tree.TreeBuilder;

/**
 * Loads models for dynamic forms. A load flattens a root class and its transitive type closure into a {@link TypeDictionary} and
 * validates its {@link InstanceTree}; the resulting {@link LoadedModel} then serves any number of evaluation requests.
 */
public class ModelForm {
	private static final Logger LOGGER = LogManager.getLogger(ModelForm.class);

	private final TypeResolver theResolver;
	private final ModelFormConfig theConfig;
	private final ExpressionParser theParser;
	private final ExpressionEvaluator theEvaluator;
	private final Map<String, LoadedModel> theCache;

	/**
	 * @param resolver The resolver for the source of referenced types
	 * @param config The settings
	 */
	public ModelForm(TypeResolver resolver, ModelFormConfig config) {
		this(resolver, config, false);
	}

	private ModelForm(TypeResolver resolver, ModelFormConfig config, boolean cache) {
		theResolver = resolver;
		theConfig = config;
		theParser = new AntlrExpressionParser();
		theEvaluator = ExpressionEvaluator.STANDARD;
		theCache = cache ? new ConcurrentHashMap<>() : null;
	}

	/**
	 * @param config The settings, whose search roots are used to find model documents
	 * @return A model loader that searches the configured directories
	 */
	public static ModelForm create(ModelFormConfig config) {
		return new ModelForm(new DirectoryTypeResolver(config.getSearchRoots()), config);
	}

	/**
	 * Creates a loader that keeps each loaded model by its root type and returns it for later loads of the same root. Caching only
	 * saves loads: the scope of a request is the same either way.
	 *
	 * @param resolver The resolver for the source of referenced types
	 * @param config The settings
	 * @return The caching model loader
	 */
	public static ModelForm cached(TypeResolver resolver, ModelFormConfig config) {
		return new ModelForm(resolver, config, true);
	}

	/**
	 * @param resolvers The resolvers for the source of referenced types, consulted in order
	 * @return A loader with the default settings, using the given resolvers
	 */
	public static ModelForm withResolvers(TypeResolver... resolvers) {
		List<TypeResolver> list = new ArrayList<>();
		for (TypeResolver resolver : resolvers)
			list.add(resolver);
		return new ModelForm(list.size() == 1 ? list.get(0) : new CompositeTypeResolver(list), ModelFormConfig.DEFAULT);
	}

	/** @return The settings of this loader */
	public ModelFormConfig getConfig() {
		return theConfig;
	}

	/** @return The resolver for the source of referenced types */
	public TypeResolver getResolver() {
		return theResolver;
	}

	/** @return Whether this loader caches loaded models */
	public boolean isCaching() {
		return theCache != null;
	}

	/**
	 * @param rootType The dotted path of the root class
	 * @return The loaded model
	 * @throws ModelLoadException If the root class or any type it depends on cannot be found, or if the model's structure is invalid
	 */
	public LoadedModel load(String rootType) throws ModelLoadException {
		return load(rootType, null);
	}

	/**
	 * @param rootType The dotted path of the root class
	 * @param rootDocument The document defining the root class, or null to find it with this loader's resolver
	 * @return The loaded model
	 * @throws ModelLoadException If the root class or any type it depends on cannot be found, or if the model's structure is invalid
	 */
	public LoadedModel load(String rootType, RawFragment rootDocument) throws ModelLoadException {
		return load(rootType, rootDocument, new Diagnostics());
	}

	/**
	 * @param rootType The dotted path of the root class
	 * @param rootDocument The document defining the root class, or null to find it with this loader's resolver
	 * @param diagnostics The record for problems encountered by the load, which becomes the loaded model's. Unused if the model is
	 *        already cached.
	 * @return The loaded model
	 * @throws ModelLoadException If the root class or any type it depends on cannot be found, or if the model's structure is invalid
	 */
	public LoadedModel load(String rootType, RawFragment rootDocument, Diagnostics diagnostics) throws ModelLoadException {
		if (theCache != null) {
			LoadedModel cached = theCache.get(rootType);
			if (cached != null)
				return cached;
		}
		LoadedModel model;
		try {
			AstFlattener flattener = new AstFlattener(theResolver, new JsonExpressionReader(theParser), diagnostics);
			if (rootDocument != null)
				flattener.addSource(rootDocument);
			DataType type = flattener.flattenType(rootType);
			if (type.isPrimitive())
				throw new TypeNotFoundException(rootType, null);
			TypeDictionary dictionary = flattener.getDictionary();
			InstanceTree tree = TreeBuilder.build(((DataType.ClassReference) type).getPath(), dictionary);
			model = new LoadedModel(tree, theEvaluator, theConfig, diagnostics);
		} catch (ModelLoadException e) {
			diagnostics.error(e);
			throw e;
		}
		LOGGER.debug("Loaded {}: {} definitions, {} instances, {} warnings", rootType, model.getDictionary().size(),
			model.getTree().size(), diagnostics.getAll().size());
		if (theCache != null) {
			LoadedModel existing = theCache.putIfAbsent(rootType, model);
			if (existing != null)
				return existing;
		}
		return model;
	}

	/**
	 * @param rootType The root type to forget
	 * @return Whether a model was cached for the root type
	 */
	public boolean evict(String rootType) {
		return theCache != null && theCache.remove(rootType) != null;
	}
}
