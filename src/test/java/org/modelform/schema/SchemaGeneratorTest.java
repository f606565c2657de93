package org.modelform.schema;

import java.io.IOException;
import java.io.StringWriter;
import java.util.Arrays;
import java.util.Collections;

import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;
import org.modelform.Diagnostics;
import org.modelform.ModelFormException;
import org.modelform.ast.ClasspathTypeResolver;
import org.modelform.dict.AstFlattener;
import org.modelform.expr.AntlrExpressionParser;
import org.modelform.expr.ExpressionEvaluator;
import org.modelform.expr.JsonExpressionReader;
import org.modelform.scope.Scope;
import org.modelform.scope.ScopeResolver;
import org.modelform.scope.Selections;
import org.modelform.tree.InstanceTree;
import org.modelform.tree.TreeBuilder;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;

/** Tests {@link SchemaGenerator} and {@link SchemaWriter} */
public class SchemaGeneratorTest {
	private InstanceTree theTree;
	private ScopeResolver theResolver;

	/**
	 * Sets up the test
	 *
	 * @throws ModelFormException If the test model cannot be loaded
	 */
	@Before
	public void setup() throws ModelFormException {
		AstFlattener flattener = new AstFlattener(new ClasspathTypeResolver(getClass().getClassLoader(), "models"),
			new JsonExpressionReader(new AntlrExpressionParser()), new Diagnostics());
		flattener.flattenType("TestModel");
		theTree = TreeBuilder.build("TestModel", flattener.getDictionary());
		theResolver = new ScopeResolver(theTree.getDictionary());
	}

	private FormSchema generate(SchemaGenerator generator, Selections selections) throws ModelFormException {
		Scope scope = theResolver.resolve(theTree, selections);
		return generator.generate(theTree, scope, selections);
	}

	/**
	 * Tests the schema of the worked test model with evaluated enable conditions
	 *
	 * @throws ModelFormException If generation fails
	 */
	@Test
	public void testEvaluatedEnable() throws ModelFormException {
		FormSchema schema = generate(new SchemaGenerator(), null);
		Assert.assertEquals("TestModel", schema.getRootType());
		Assert.assertEquals("Model for form tests", schema.getDescription());
		Assert.assertEquals(3, schema.getNodes().size());

		SchemaNode nested = new SchemaNode("subModel.nestedBoolean", "Boolean", true, true, "Nested flag",
			Collections.<SchemaNode> emptyList());
		Assert.assertEquals(Arrays.asList(//
			new SchemaNode("hello", "String", "World", true, "Greeting", Collections.<SchemaNode> emptyList()), //
			new SchemaNode("allow_hello", "Boolean", true, true, "Allow greeting", Collections.<SchemaNode> emptyList()), //
			new SchemaNode("subModel", "SubFolder.SubModel", null, true, "Sub model", Arrays.asList(nested))), //
			schema.getNodes());
		Assert.assertEquals(nested, schema.find("subModel.nestedBoolean"));
		Assert.assertNull(schema.find("subModel.other"));

		schema = generate(new SchemaGenerator(), Selections.empty().with("subModel.nestedBoolean", false));
		Assert.assertFalse(schema.find("hello").isEnabled());
		Assert.assertEquals("World", schema.find("hello").getValue());
		Assert.assertEquals(Boolean.FALSE, schema.find("allow_hello").getValue());
		Assert.assertTrue(schema.find("allow_hello").isEnabled());
	}

	/**
	 * Tests that enable conditions are written as expression text when not evaluated
	 *
	 * @throws ModelFormException If generation fails
	 */
	@Test
	public void testEnableAsText() throws ModelFormException {
		SchemaGenerator generator = new SchemaGenerator(ExpressionEvaluator.STANDARD, false);
		Assert.assertFalse(generator.isEvaluatingEnable());
		FormSchema schema = generate(generator, null);
		Assert.assertEquals("allow_hello == true", schema.find("hello").getEnable());
		Assert.assertFalse(schema.find("hello").isEnabled());
		Assert.assertEquals("true", schema.find("allow_hello").getEnable());
		Assert.assertEquals("true", schema.find("subModel.nestedBoolean").getEnable());
	}

	/**
	 * Tests the JSON form of a schema
	 *
	 * @throws ModelFormException If generation fails
	 * @throws IOException If writing fails
	 */
	@Test
	public void testWriteJson() throws ModelFormException, IOException {
		FormSchema schema = generate(new SchemaGenerator(), null);
		JsonObject json = new SchemaWriter().toJson(schema);
		Assert.assertEquals("TestModel", json.get("rootType").getAsString());
		JsonArray nodes = json.getAsJsonArray("nodes");
		Assert.assertEquals(3, nodes.size());

		JsonObject hello = nodes.get(0).getAsJsonObject();
		Assert.assertEquals("hello", hello.get("path").getAsString());
		Assert.assertEquals("String", hello.get("type").getAsString());
		Assert.assertEquals("World", hello.get("value").getAsString());
		Assert.assertTrue(hello.get("enable").getAsBoolean());
		Assert.assertEquals("Greeting", hello.get("description").getAsString());
		Assert.assertEquals(0, hello.getAsJsonArray("childNodes").size());

		JsonObject subModel = nodes.get(2).getAsJsonObject();
		Assert.assertTrue(subModel.get("value").isJsonNull());
		JsonObject nested = subModel.getAsJsonArray("childNodes").get(0).getAsJsonObject();
		Assert.assertEquals("subModel.nestedBoolean", nested.get("path").getAsString());
		Assert.assertTrue(nested.get("value").getAsBoolean());

		StringWriter writer = new StringWriter();
		new SchemaWriter(false).write(schema, writer);
		String compact = writer.toString();
		Assert.assertFalse(compact.contains("\n"));
		Assert.assertTrue(compact.contains("\"value\":null"));
		Assert.assertEquals(json, JsonParser.parseString(compact));
		Assert.assertEquals(json, JsonParser.parseString(new SchemaWriter().toString(schema)));
	}
}
