package org.modelform.expr.ops;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

import com.google.common.collect.ImmutableMap;

/** A set of unary operations that an {@link org.modelform.expr.ExpressionEvaluator} can use to apply unary operators */
public class UnaryOperatorSet {
	/**
	 * A unary operator that knows how to operate on 1 input
	 *
	 * @param <S> The super-type of the input that this operator knows how to handle
	 * @param <T> The type of output produced by this operator
	 */
	public interface UnaryOp<S, T> {
		/** @return The type of output produced by this operator */
		Class<T> getTargetType();

		/**
		 * Performs the operation
		 *
		 * @param source The input value
		 * @return The output value
		 */
		T apply(S source);

		/**
		 * Produces a unary operator
		 *
		 * @param <S> The type of the input
		 * @param <T> The type of the output
		 * @param name The name of the operator
		 * @param type The type of the output
		 * @param op The function to use for {@link UnaryOp#apply(Object)}
		 * @return The unary operator composed of the given function
		 */
		static <S, T> UnaryOp<S, T> of(String name, Class<T> type, Function<? super S, ? extends T> op) {
			return new UnaryOp<S, T>() {
				@Override
				public Class<T> getTargetType() {
					return type;
				}

				@Override
				public T apply(S source) {
					return op.apply(source);
				}

				@Override
				public String toString() {
					return name;
				}
			};
		}
	}

	/** A {@link UnaryOperatorSet} supporting the closed set of model expression operators */
	public static final UnaryOperatorSet STANDARD = build().withStandardOps().build();

	/** Operators by name and input type */
	private final Map<String, Map<Class<?>, UnaryOp<?, ?>>> theOperators;

	private UnaryOperatorSet(Map<String, Map<Class<?>, UnaryOp<?, ?>>> operators) {
		theOperators = operators;
	}

	/** @return The names of all operators this set supports for any input type */
	public Set<String> getOperators() {
		return theOperators.keySet();
	}

	/**
	 * @param operator The name of the operator
	 * @return Whether this set supports the given operator for any input type
	 */
	public boolean supports(String operator) {
		return theOperators.containsKey(operator);
	}

	/**
	 * @param operator The name of the operator
	 * @return All input types that this operator set knows of for which the given operator may be applied
	 */
	public Set<Class<?>> getSupportedInputTypes(String operator) {
		Map<Class<?>, UnaryOp<?, ?>> ops = theOperators.get(operator);
		if (ops == null)
			return Collections.emptySet();
		return ops.keySet();
	}

	/**
	 * @param <S> The type of the input
	 * @param operator The name of the operator
	 * @param type The type of the input
	 * @return The unary operator supported by this operator set with the given operator and input type, or null if there is none
	 */
	public <S> UnaryOp<S, ?> getOperator(String operator, Class<S> type) {
		Map<Class<?>, UnaryOp<?, ?>> ops = theOperators.get(operator);
		if (ops == null)
			return null;
		UnaryOp<S, ?> ret = null;
		for (Map.Entry<Class<?>, UnaryOp<?, ?>> op : ops.entrySet()) {
			if (op.getKey().isAssignableFrom(type))
				ret = (UnaryOp<S, ?>) op.getValue();
		}
		return ret;
	}

	/** @return A builder pre-configured for all of this operator set's operations */
	public Builder copy() {
		Builder copy = build();
		for (Map.Entry<String, Map<Class<?>, UnaryOp<?, ?>>> op : theOperators.entrySet()) {
			for (Map.Entry<Class<?>, UnaryOp<?, ?>> op2 : op.getValue().entrySet())
				copy.with(op.getKey(), (Class<Object>) op2.getKey(), (UnaryOp<Object, ?>) op2.getValue());
		}
		return copy;
	}

	/** @return A builder that may be configured to support various unary operations */
	public static Builder build() {
		return new Builder();
	}

	/** A builder that may be configured to support various unary operations */
	public static class Builder {
		private final Map<String, Map<Class<?>, UnaryOp<?, ?>>> theOperators;

		Builder() {
			theOperators = new LinkedHashMap<>();
		}

		/**
		 * Installs support for an operator
		 *
		 * @param <S> The type of the input
		 * @param operator The name of the operator
		 * @param type The type of the input
		 * @param op The operator to support the given operation
		 * @return This builder
		 */
		public <S> Builder with(String operator, Class<S> type, UnaryOp<S, ?> op) {
			theOperators.computeIfAbsent(operator, __ -> new LinkedHashMap<>()).put(type, op);
			return this;
		}

		/**
		 * Installs support for an operator whose output type is the same as its input
		 *
		 * @param <T> The type of the input and output
		 * @param operator The name of the operator
		 * @param type The type of the input and output
		 * @param op The function to perform the operation
		 * @return This builder
		 */
		public <T> Builder withSym(String operator, Class<T> type, Function<? super T, ? extends T> op) {
			return with(operator, type, UnaryOp.<T, T> of(operator, type, op));
		}

		/**
		 * Installs support for boolean negation
		 *
		 * @return This builder
		 */
		public Builder withStandardOps() {
			return withSym("!", Boolean.class, b -> b == null || !b.booleanValue());
		}

		/** @return A unary operator set with the support installed in this builder */
		public UnaryOperatorSet build() {
			ImmutableMap.Builder<String, Map<Class<?>, UnaryOp<?, ?>>> operators = ImmutableMap.builder();
			for (Map.Entry<String, Map<Class<?>, UnaryOp<?, ?>>> op : theOperators.entrySet())
				operators.put(op.getKey(), ImmutableMap.copyOf(op.getValue()));
			return new UnaryOperatorSet(operators.build());
		}
	}
}
