package org.modelform.dict;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.modelform.expr.Expression;
import org.modelform.expr.Literal;

import com.google.common.collect.ImmutableMap;

/**
 * A declared member of a class. A component of a {@link DataType.Primitive primitive} type carries a value; a component of a
 * {@link DataType.ClassReference class} type has the referenced class as its only child and may carry overrides for that class's
 * members.
 */
public final class ComponentDefinition extends Definition {
	private final DataType theDataType;
	private final Expression theDeclaredValue;
	private final Expression theEnableExpression;
	private final Map<String, Expression> theOverrides;

	/**
	 * @param path The absolute dotted path of the component
	 * @param dataType The type of the component
	 * @param declaredValue The value the component is declared with, or null
	 * @param description The label text for the component, or null
	 * @param enableExpression The condition under which the component is enabled, or null for always
	 * @param overrides Values for members of the component's class, keyed by dotted path relative to this component
	 */
	public ComponentDefinition(String path, DataType dataType, Expression declaredValue, String description, Expression enableExpression,
		Map<String, ? extends Expression> overrides) {
		super(path, description);
		theDataType = Objects.requireNonNull(dataType, "dataType");
		theDeclaredValue = declaredValue;
		theEnableExpression = enableExpression == null ? Literal.TRUE : enableExpression;
		theOverrides = overrides == null ? ImmutableMap.of() : ImmutableMap.copyOf(overrides);
	}

	@Override
	public DefinitionKind getKind() {
		return DefinitionKind.INSTANTIABLE_COMPONENT;
	}

	/** @return The type of the component */
	public DataType getDataType() {
		return theDataType;
	}

	/** @return The value the component is declared with, or null */
	public Expression getDeclaredValue() {
		return theDeclaredValue;
	}

	/** @return The condition under which the component is enabled */
	public Expression getEnableExpression() {
		return theEnableExpression;
	}

	/** @return Values for members of the component's class, keyed by dotted path relative to this component */
	public Map<String, Expression> getOverrides() {
		return theOverrides;
	}

	@Override
	public List<String> getChildren() {
		if (theDataType instanceof DataType.ClassReference)
			return Collections.singletonList(((DataType.ClassReference) theDataType).getPath());
		return Collections.emptyList();
	}

	/**
	 * @param path The path for the copy
	 * @return A copy of this component at a different path, as for a member inherited into a derived class
	 */
	public ComponentDefinition atPath(String path) {
		return new ComponentDefinition(path, theDataType, theDeclaredValue, getDescription(), theEnableExpression, theOverrides);
	}

	/**
	 * @param declaredValue The declared value for the copy
	 * @param overrides Additional overrides for the copy, taking precedence over this component's own
	 * @return A copy of this component with the given modifications applied
	 */
	public ComponentDefinition modified(Expression declaredValue, Map<String, ? extends Expression> overrides) {
		Map<String, Expression> newOverrides = theOverrides;
		if (!overrides.isEmpty()) {
			ImmutableMap.Builder<String, Expression> merged = ImmutableMap.builder();
			for (Map.Entry<String, Expression> own : theOverrides.entrySet()) {
				if (!overrides.containsKey(own.getKey()))
					merged.put(own);
			}
			merged.putAll(overrides);
			newOverrides = merged.build();
		}
		return new ComponentDefinition(getPath(), theDataType, declaredValue == null ? theDeclaredValue : declaredValue, getDescription(),
			theEnableExpression, newOverrides);
	}

	@Override
	public boolean equals(Object obj) {
		if (!super.equals(obj))
			return false;
		ComponentDefinition other = (ComponentDefinition) obj;
		return theDataType.equals(other.theDataType) && Objects.equals(theDeclaredValue, other.theDeclaredValue)
			&& theEnableExpression.equals(other.theEnableExpression) && theOverrides.equals(other.theOverrides);
	}

	@Override
	public int hashCode() {
		return super.hashCode();
	}
}
