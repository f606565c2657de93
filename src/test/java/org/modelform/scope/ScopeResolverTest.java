package org.modelform.scope;

import static org.modelform.AstFixtures.arg;
import static org.modelform.AstFixtures.classDef;
import static org.modelform.AstFixtures.component;
import static org.modelform.AstFixtures.fragment;
import static org.modelform.AstFixtures.mod;

import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;
import org.modelform.CyclicReferenceException;
import org.modelform.Diagnostics;
import org.modelform.ErrorKind;
import org.modelform.ModelEvaluationException;
import org.modelform.ModelFormException;
import org.modelform.ModelLoadException;
import org.modelform.ResolutionBudgetExceededException;
import org.modelform.UnresolvedVariableException;
import org.modelform.ast.ClasspathTypeResolver;
import org.modelform.ast.MapTypeResolver;
import org.modelform.ast.RawFragment;
import org.modelform.ast.TypeResolver;
import org.modelform.dict.AstFlattener;
import org.modelform.dict.ClassDefinition;
import org.modelform.dict.ComponentDefinition;
import org.modelform.dict.DataType;
import org.modelform.dict.TypeDictionary;
import org.modelform.expr.AntlrExpressionParser;
import org.modelform.expr.Expression;
import org.modelform.expr.ExpressionEvaluator;
import org.modelform.expr.ExpressionParseException;
import org.modelform.expr.JsonExpressionReader;
import org.modelform.expr.Literal;
import org.modelform.expr.VariableReference;

/** Tests {@link ScopeResolver}, {@link Scope} and {@link Selections} */
public class ScopeResolverTest {
	private TypeResolver theModels;

	/** Sets up the test */
	@Before
	public void setup() {
		theModels = new ClasspathTypeResolver(getClass().getClassLoader(), "models");
	}

	private static TypeDictionary flatten(TypeResolver resolver, String root) throws ModelLoadException {
		AstFlattener flattener = new AstFlattener(resolver, new JsonExpressionReader(new AntlrExpressionParser()), new Diagnostics());
		flattener.flattenType(root);
		return flattener.getDictionary();
	}

	private static Scope resolve(RawFragment pkg, String root, Selections selections) throws ModelFormException {
		return new ScopeResolver(flatten(new MapTypeResolver().with(root, pkg), root)).resolve(root, selections);
	}

	/**
	 * Resolves the worked test model and evaluates the enable condition of its greeting
	 *
	 * @throws ModelFormException If resolution fails
	 */
	@Test
	public void testTestModel() throws ModelFormException {
		TypeDictionary dict = flatten(theModels, "TestModel");
		Scope scope = new ScopeResolver(dict).resolve("TestModel", null);
		Map<String, Object> expected = new LinkedHashMap<>();
		expected.put("hello", "World");
		expected.put("allow_hello", true);
		expected.put("subModel.nestedBoolean", true);
		Assert.assertEquals(expected, scope.asMap());
		Assert.assertEquals(Arrays.asList("hello", "allow_hello", "subModel.nestedBoolean"), new ArrayList<>(scope.asMap().keySet()));
		Assert.assertFalse(scope.contains("subModel"));
		Assert.assertEquals("TestModel", scope.getRootType());

		ComponentDefinition hello = (ComponentDefinition) dict.get("TestModel.hello");
		Assert.assertEquals(Boolean.TRUE, ExpressionEvaluator.STANDARD.evaluate(hello.getEnableExpression(), scope, null));
	}

	/**
	 * Tests that resolving the same model twice gives equal scopes
	 *
	 * @throws ModelFormException If resolution fails
	 */
	@Test
	public void testRepeatable() throws ModelFormException {
		ScopeResolver resolver = new ScopeResolver(flatten(theModels, "TestModel"));
		Selections selections = Selections.empty().with("hello", "Hi");
		Assert.assertEquals(resolver.resolve("TestModel", selections), resolver.resolve("TestModel", selections));
	}

	/**
	 * Tests that selections win over overrides and declared values, and flow into dependent values
	 *
	 * @throws ModelFormException If resolution fails
	 */
	@Test
	public void testSelections() throws ModelFormException {
		ScopeResolver resolver = new ScopeResolver(flatten(theModels, "TestModel"));
		Scope scope = resolver.resolve("TestModel", Selections.empty().with("subModel.nestedBoolean", false));
		Assert.assertEquals(Boolean.FALSE, scope.get("subModel.nestedBoolean"));
		Assert.assertEquals(Boolean.FALSE, scope.get("allow_hello"));

		scope = resolver.resolve("TestModel", Selections.empty().with("allow_hello", false));
		Assert.assertEquals(Boolean.FALSE, scope.get("allow_hello"));
		Assert.assertEquals(Boolean.TRUE, scope.get("subModel.nestedBoolean"));

		try {
			resolver.resolve("TestModel", Selections.empty().with("subModel.nestedBoolean", "yes"));
			Assert.fail("Expected a string selection for a boolean to fail");
		} catch (ModelEvaluationException e) {
			Assert.assertEquals(ErrorKind.TYPE_MISMATCH, e.getKind());
			Assert.assertEquals("subModel.nestedBoolean", e.getPath());
		}
	}

	/**
	 * Tests that references are looked up in the enclosing instances, and that overrides are evaluated where they were supplied
	 *
	 * @throws ModelFormException If resolution fails
	 * @throws ExpressionParseException If a test expression cannot be parsed
	 */
	@Test
	public void testLookupContext() throws ModelFormException, ExpressionParseException {
		RawFragment pkg = fragment("pkg", null, //
			classDef("model", "Outer", null, component("Integer", "limit", "5"), //
				component("Mid", "mid", mod(null, arg("inner.big", "limit > 7")), null, null)), //
			classDef("model", "Mid", null, component("Integer", "limit", "10"), component("Boolean", "over", "limit > 3"),
				component("Inner", "inner", null)), //
			classDef("model", "Inner", null, component("Boolean", "big", "false"), component("Boolean", "small", "limit < 8")));
		Scope scope = resolve(pkg, "Outer", null);
		Assert.assertEquals(5, scope.get("limit"));
		Assert.assertEquals(10, scope.get("mid.limit"));
		Assert.assertEquals(Boolean.TRUE, scope.get("mid.over"));
		// Supplied in Outer, so limit is Outer's
		Assert.assertEquals(Boolean.FALSE, scope.get("mid.inner.big"));
		// Declared in Inner, so limit is found in the nearest enclosing instance
		Assert.assertEquals(Boolean.FALSE, scope.get("mid.inner.small"));

		Assert.assertEquals(Boolean.TRUE, ExpressionEvaluator.STANDARD.evaluate(//
			new AntlrExpressionParser().parse("limit > 7"), scope.lookup("mid.inner", null)));
		Assert.assertEquals(Boolean.FALSE, ExpressionEvaluator.STANDARD.evaluate(//
			new AntlrExpressionParser().parse("limit > 7"), scope.lookup("mid.inner", Selections.empty().with("mid.limit", 7))));
	}

	/**
	 * Tests that numeric values are converted to the declared type
	 *
	 * @throws ModelFormException If resolution fails
	 */
	@Test
	public void testCoercion() throws ModelFormException {
		ScopeResolver resolver = new ScopeResolver(flatten(theModels, "Library.Sensor"));
		Scope scope = resolver.resolve("Library.Sensor", null);
		Assert.assertEquals(Double.valueOf(20), scope.get("setpoint"));
		Assert.assertFalse(scope.contains("heating"));
		Assert.assertEquals(1, scope.size());

		scope = resolver.resolve("Library.Sensor", Selections.empty().with("setpoint", 18).with("heating", true));
		Assert.assertEquals(Double.valueOf(18), scope.get("setpoint"));
		Assert.assertEquals(Boolean.TRUE, resolver.getValue(scope, "heating"));
	}

	/**
	 * Tests that values depending on each other fail
	 *
	 * @throws ModelLoadException If the model cannot be loaded
	 */
	@Test
	public void testCyclicReference() throws ModelLoadException {
		RawFragment pkg = fragment("pkg", null, classDef("model", "M", null, //
			component("Boolean", "a", "b"), component("Boolean", "b", "a"), component("Boolean", "c", "true")));
		try {
			resolve(pkg, "M", null);
			Assert.fail("Expected a cyclic reference");
		} catch (CyclicReferenceException e) {
			Assert.assertEquals(Arrays.asList("a", "b", "a"), e.getCycle());
			Assert.assertEquals(ErrorKind.CYCLIC_REFERENCE, e.getKind());
		} catch (ModelFormException e) {
			throw new AssertionError("Wrong failure", e);
		}

		// Selecting a value for one member breaks the cycle
		try {
			Scope scope = resolve(pkg, "M", Selections.empty().with("b", true));
			Assert.assertEquals(Boolean.TRUE, scope.get("a"));
		} catch (ModelFormException e) {
			throw new AssertionError("Selection should break the cycle", e);
		}
	}

	/**
	 * Tests the node visit budget
	 *
	 * @throws ModelFormException If resolution fails within the budget
	 */
	@Test
	public void testBudget() throws ModelFormException {
		TypeDictionary dict = flatten(theModels, "TestModel");
		try {
			new ScopeResolver(dict, ExpressionEvaluator.STANDARD, 3).resolve("TestModel", null);
			Assert.fail("Expected the budget to be exceeded");
		} catch (ResolutionBudgetExceededException e) {
			Assert.assertEquals(3, e.getBudget());
		}
		Assert.assertEquals(3, new ScopeResolver(dict, ExpressionEvaluator.STANDARD, 10).resolve("TestModel", null).size());

		try {
			new ScopeResolver(dict, ExpressionEvaluator.STANDARD, 0);
			Assert.fail("Expected a zero budget to be rejected");
		} catch (IllegalArgumentException e) {
			Assert.assertNotNull(e.getMessage());
		}
	}

	/**
	 * Builds a model M of boolean components x0..x(length-1), where each refers to the next and the last has the given value
	 *
	 * @param length The number of components in the chain
	 * @param last The value of the last component
	 * @return The dictionary
	 */
	private static TypeDictionary chain(int length, Expression last) {
		TypeDictionary.Builder builder = TypeDictionary.build();
		List<String> children = new ArrayList<>();
		for (int i = 0; i < length; i++) {
			children.add("M.x" + i);
			builder.add(new ComponentDefinition("M.x" + i, DataType.Primitive.BOOLEAN, //
				i == length - 1 ? last : new VariableReference("x" + (i + 1)), null, null, null));
		}
		builder.add(new ClassDefinition("M", "model", null, children, Collections.<String> emptyList()));
		return builder.build();
	}

	/**
	 * Tests that a long chain of forward references resolves without exhausting the call stack
	 *
	 * @throws ModelFormException If resolution fails
	 */
	@Test
	public void testLongChain() throws ModelFormException {
		int length = 20_000;
		Scope scope = new ScopeResolver(chain(length, Literal.TRUE)).resolve("M", null);
		Assert.assertEquals(length, scope.size());
		Assert.assertEquals(Boolean.TRUE, scope.get("x0"));
		Assert.assertEquals(Boolean.TRUE, scope.get("x" + (length / 2)));

		try {
			new ScopeResolver(chain(length, new VariableReference("x0"))).resolve("M", null);
			Assert.fail("Expected a cyclic reference");
		} catch (CyclicReferenceException e) {
			Assert.assertEquals(length + 1, e.getCycle().size());
			Assert.assertEquals("x0", e.getCycle().get(0));
			Assert.assertEquals("x0", e.getCycle().get(length));
		}

		try {
			new ScopeResolver(chain(length, Literal.TRUE), ExpressionEvaluator.STANDARD, length / 2).resolve("M", null);
			Assert.fail("Expected the budget to be exceeded");
		} catch (ResolutionBudgetExceededException e) {
			Assert.assertEquals(length / 2, e.getBudget());
		}
	}

	/**
	 * Tests that values read many times count once against the node visit budget
	 *
	 * @throws ModelFormException If resolution fails within the budget
	 */
	@Test
	public void testBudgetCountsInstances() throws ModelFormException {
		TypeDictionary.Builder builder = TypeDictionary.build();
		List<String> children = new ArrayList<>();
		children.add("M.base");
		builder.add(new ComponentDefinition("M.base", DataType.Primitive.BOOLEAN, Literal.TRUE, null, null, null));
		for (int i = 0; i < 5; i++) {
			children.add("M.r" + i);
			builder.add(new ComponentDefinition("M.r" + i, DataType.Primitive.BOOLEAN, new VariableReference("base"), null, null, null));
		}
		builder.add(new ClassDefinition("M", "model", null, children, Collections.<String> emptyList()));
		TypeDictionary dict = builder.build();

		Scope scope = new ScopeResolver(dict, ExpressionEvaluator.STANDARD, 6).resolve("M", null);
		Assert.assertEquals(6, scope.size());
		Assert.assertEquals(Boolean.TRUE, scope.get("r4"));
		try {
			new ScopeResolver(dict, ExpressionEvaluator.STANDARD, 5).resolve("M", null);
			Assert.fail("Expected the budget to be exceeded");
		} catch (ResolutionBudgetExceededException e) {
			Assert.assertEquals("r4", e.getPath());
		}
	}

	/**
	 * Tests that reals are not narrowed to integers, even when integral
	 *
	 * @throws ModelFormException If resolution fails unexpectedly
	 */
	@Test
	public void testNoNarrowing() throws ModelFormException {
		RawFragment pkg = fragment("pkg", null, classDef("model", "M", null, component("Integer", "count", "4")));
		Assert.assertEquals(4, resolve(pkg, "M", null).get("count"));
		Assert.assertEquals(3, resolve(pkg, "M", Selections.empty().with("count", 3L)).get("count"));
		try {
			resolve(pkg, "M", Selections.empty().with("count", 2.0));
			Assert.fail("Expected a real selection for an integer to fail");
		} catch (ModelEvaluationException e) {
			Assert.assertEquals(ErrorKind.TYPE_MISMATCH, e.getKind());
			Assert.assertEquals("count", e.getPath());
		}

		pkg = fragment("pkg", null, classDef("model", "M", null, component("Integer", "count", "2.0")));
		try {
			resolve(pkg, "M", null);
			Assert.fail("Expected a real value for an integer to fail");
		} catch (ModelEvaluationException e) {
			Assert.assertEquals(ErrorKind.TYPE_MISMATCH, e.getKind());
		}
	}

	/**
	 * Tests references to missing instances and to instances without values
	 *
	 * @throws ModelFormException If resolution fails unexpectedly
	 */
	@Test
	public void testUnresolved() throws ModelFormException {
		for (String ref : new String[] { "missing", "empty" }) {
			RawFragment pkg = fragment("pkg", null, classDef("model", "M", null, //
				component("Boolean", "a", ref + " == true"), component("Boolean", "empty", null)));
			try {
				resolve(pkg, "M", null);
				Assert.fail("Expected " + ref + " to be unresolved");
			} catch (UnresolvedVariableException e) {
				Assert.assertEquals(ref, e.getReference());
			}
		}

		Scope scope = new ScopeResolver(flatten(theModels, "TestModel")).resolve("TestModel", null);
		try {
			new ScopeResolver(TypeDictionary.build().build()).getValue(scope, "subModel");
			Assert.fail("Expected a class instance to have no value");
		} catch (UnresolvedVariableException e) {
			Assert.assertEquals("subModel", e.getReference());
		}
	}

	/**
	 * Tests reading selections from JSON
	 *
	 * @throws IOException If good selections cannot be read
	 */
	@Test
	public void testReadSelections() throws IOException {
		Selections selections = Selections.read(new StringReader("{\"a.b\": 1, \"c\": \"text\", \"d\": true, \"e\": 2.5}"));
		Assert.assertEquals(4, selections.asMap().size());
		Assert.assertEquals(1, selections.get("a.b"));
		Assert.assertEquals("text", selections.get("c"));
		Assert.assertEquals(Boolean.TRUE, selections.get("d"));
		Assert.assertEquals(2.5, selections.get("e"));
		Assert.assertTrue(Selections.read(new StringReader("null")).isEmpty());

		for (String bad : new String[] { "[1]", "{\"a\": [1]}", "{\"a\": {\"b\": 1}}", "{ oops" }) {
			try {
				Selections.read(new StringReader(bad));
				Assert.fail("Expected " + bad + " to be rejected");
			} catch (IOException e) {
				Assert.assertNotNull(e.getMessage());
			}
		}

		try {
			Selections.empty().with("a", new Object());
			Assert.fail("Expected an unsupported value to be rejected");
		} catch (IllegalArgumentException e) {
			Assert.assertTrue(e.getMessage().contains("a"));
		}
	}
}
