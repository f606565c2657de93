package org.modelform.expr.ops;

import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.function.BiFunction;

import org.modelform.expr.Values;

import com.google.common.collect.ImmutableMap;

/** A set of binary operations that an {@link org.modelform.expr.ExpressionEvaluator} can use to apply binary operators */
public class BinaryOperatorSet {
	/**
	 * A binary operator that knows how to operate on 2 inputs
	 *
	 * @param <S> The super-type of the first input that this operator knows how to handle
	 * @param <T> The super-type of the second input that this operator knows how to handle
	 * @param <V> The type of output produced by this operator
	 */
	public interface BinaryOp<S, T, V> {
		/** @return The type of output produced by this operator */
		Class<V> getTargetType();

		/**
		 * Performs the operation
		 *
		 * @param source The first input value
		 * @param other The second input value
		 * @return The output value
		 */
		V apply(S source, T other);

		/**
		 * Produces a binary operator from a function
		 *
		 * @param <S> The primary input type of the operator
		 * @param <T> The secondary input type of the operator
		 * @param <V> The output type of the operator
		 * @param name The name of the operator
		 * @param type The output type of the operator
		 * @param op The function to use for {@link BinaryOp#apply(Object, Object)}
		 * @return The binary operator composed of the given function
		 */
		static <S, T, V> BinaryOp<S, T, V> of(String name, Class<V> type, BiFunction<? super S, ? super T, ? extends V> op) {
			return new BinaryOp<S, T, V>() {
				@Override
				public Class<V> getTargetType() {
					return type;
				}

				@Override
				public V apply(S source, T other) {
					return op.apply(source, other);
				}

				@Override
				public String toString() {
					return name;
				}
			};
		}
	}

	/** Represents something that can configure a {@link Builder} to support some set of binary operations */
	public interface BinaryOperatorConfiguration {
		/**
		 * Configures a binary operator set builder to support some set of binary operations
		 *
		 * @param operators The builder to configure
		 * @return The builder
		 */
		Builder configure(Builder operators);
	}

	/**
	 * Configures a binary operator set to support the closed set of model expression operators: equality and ordering of numbers,
	 * booleans and strings, and boolean conjunction and disjunction
	 *
	 * @param operators The builder to configure
	 * @return The builder
	 */
	public static Builder standard(Builder operators) {
		// Integer and Real operands are both Numbers, so mixed numeric comparisons need no casts
		operators.withComparisonOps(Number.class, Values::compareNumbers);
		operators.withComparisonOps(Boolean.class, Boolean::compare);
		operators.withComparisonOps(String.class, String::compareTo);
		operators.with("&&", Boolean.class, Boolean.class, Boolean.class, (b1, b2) -> unwrapBool(b1) && unwrapBool(b2));
		operators.with("||", Boolean.class, Boolean.class, Boolean.class, (b1, b2) -> unwrapBool(b1) || unwrapBool(b2));
		return operators;
	}

	/** A {@link BinaryOperatorSet} supporting the closed set of model expression operators */
	public static final BinaryOperatorSet STANDARD = standard(build()).build();

	/** Operators by name, primary type, and secondary type */
	private final Map<String, Map<Class<?>, Map<Class<?>, BinaryOp<?, ?, ?>>>> theOperators;

	private BinaryOperatorSet(Map<String, Map<Class<?>, Map<Class<?>, BinaryOp<?, ?, ?>>>> operators) {
		theOperators = operators;
	}

	/** @return The names of all operators this set supports for any input types */
	public Set<String> getOperators() {
		return theOperators.keySet();
	}

	/**
	 * @param operator The name of the operator
	 * @return Whether this set supports the given operator for any input types
	 */
	public boolean supports(String operator) {
		return theOperators.containsKey(operator);
	}

	/**
	 * @param operator The name of the operator
	 * @return All primary input types that this operator set knows of for which the given operator may be applied
	 */
	public Set<Class<?>> getSupportedPrimaryInputTypes(String operator) {
		Map<Class<?>, Map<Class<?>, BinaryOp<?, ?, ?>>> ops = theOperators.get(operator);
		if (ops == null)
			return Collections.emptySet();
		return ops.keySet();
	}

	/**
	 * @param <S> The primary input type
	 * @param <T> The secondary input type
	 * @param operator The name of the operator
	 * @param primaryType The type of the primary input
	 * @param secondaryType The type of the secondary input
	 * @return The binary operator supported by this operator set with the given operator and input types, or null if there is none
	 */
	public <S, T> BinaryOp<S, T, ?> getOperator(String operator, Class<S> primaryType, Class<T> secondaryType) {
		Map<Class<?>, Map<Class<?>, BinaryOp<?, ?, ?>>> ops = theOperators.get(operator);
		if (ops == null)
			return null;
		// Use the most recently installed match, which should be the most specific
		BinaryOp<S, T, ?> ret = null;
		for (Map.Entry<Class<?>, Map<Class<?>, BinaryOp<?, ?, ?>>> ops2 : ops.entrySet()) {
			if (!ops2.getKey().isAssignableFrom(primaryType))
				continue;
			for (Map.Entry<Class<?>, BinaryOp<?, ?, ?>> op : ops2.getValue().entrySet()) {
				if (op.getKey().isAssignableFrom(secondaryType))
					ret = (BinaryOp<S, T, ?>) op.getValue();
			}
		}
		return ret;
	}

	/** @return A builder pre-configured for all of this operator set's operations */
	public Builder copy() {
		Builder copy = build();
		for (Map.Entry<String, Map<Class<?>, Map<Class<?>, BinaryOp<?, ?, ?>>>> op : theOperators.entrySet()) {
			for (Map.Entry<Class<?>, Map<Class<?>, BinaryOp<?, ?, ?>>> op2 : op.getValue().entrySet()) {
				for (Map.Entry<Class<?>, BinaryOp<?, ?, ?>> op3 : op2.getValue().entrySet())
					copy.with(op.getKey(), (Class<Object>) op2.getKey(), (Class<Object>) op3.getKey(), (BinaryOp<Object, Object, ?>) op3.getValue());
			}
		}
		return copy;
	}

	/** @return A builder that may be configured to support various binary operations */
	public static Builder build() {
		return new Builder();
	}

	/** A builder that may be configured to support various binary operations */
	public static class Builder {
		private final Map<String, Map<Class<?>, Map<Class<?>, BinaryOp<?, ?, ?>>>> theOperators;

		Builder() {
			theOperators = new LinkedHashMap<>();
		}

		/**
		 * Installs support for an operator
		 *
		 * @param <S> The type of the primary input
		 * @param <T> The type of the secondary input
		 * @param operator The name of the operator
		 * @param primary The type of the primary input
		 * @param secondary The type of the secondary input
		 * @param op The operator to support the given operation
		 * @return This builder
		 */
		public <S, T> Builder with(String operator, Class<S> primary, Class<T> secondary, BinaryOp<S, T, ?> op) {
			theOperators.computeIfAbsent(operator, __ -> new LinkedHashMap<>())//
			.computeIfAbsent(primary, __ -> new LinkedHashMap<>())//
			.put(secondary, op);
			return this;
		}

		/**
		 * Installs support for an operator
		 *
		 * @param <S> The type of the primary input
		 * @param <T> The type of the secondary input
		 * @param <V> The type of the output
		 * @param operator The name of the operator
		 * @param primary The type of the primary input
		 * @param secondary The type of the secondary input
		 * @param target The type of the output
		 * @param op The function to perform the operation
		 * @return This builder
		 */
		public <S, T, V> Builder with(String operator, Class<S> primary, Class<T> secondary, Class<V> target,
			BiFunction<? super S, ? super T, ? extends V> op) {
			return with(operator, primary, secondary, BinaryOp.of(operator, target, op));
		}

		/**
		 * Installs the equality and ordering operators for values of the same type
		 *
		 * @param <C> The type of values to compare
		 * @param type The type of values to compare
		 * @param comparator Compares 2 values of the type
		 * @return This builder
		 */
		public <C> Builder withComparisonOps(Class<C> type, Comparator<? super C> comparator) {
			with("==", type, type, Boolean.class, (c1, c2) -> comparator.compare(c1, c2) == 0);
			with("!=", type, type, Boolean.class, (c1, c2) -> comparator.compare(c1, c2) != 0);
			with("<", type, type, Boolean.class, (c1, c2) -> comparator.compare(c1, c2) < 0);
			with("<=", type, type, Boolean.class, (c1, c2) -> comparator.compare(c1, c2) <= 0);
			with(">", type, type, Boolean.class, (c1, c2) -> comparator.compare(c1, c2) > 0);
			with(">=", type, type, Boolean.class, (c1, c2) -> comparator.compare(c1, c2) >= 0);
			return this;
		}

		/** @return A binary operator set with the support installed in this builder */
		public BinaryOperatorSet build() {
			ImmutableMap.Builder<String, Map<Class<?>, Map<Class<?>, BinaryOp<?, ?, ?>>>> operators = ImmutableMap.builder();
			for (Map.Entry<String, Map<Class<?>, Map<Class<?>, BinaryOp<?, ?, ?>>>> op : theOperators.entrySet()) {
				ImmutableMap.Builder<Class<?>, Map<Class<?>, BinaryOp<?, ?, ?>>> ops = ImmutableMap.builder();
				for (Map.Entry<Class<?>, Map<Class<?>, BinaryOp<?, ?, ?>>> op2 : op.getValue().entrySet())
					ops.put(op2.getKey(), ImmutableMap.copyOf(op2.getValue()));
				operators.put(op.getKey(), ops.build());
			}
			return new BinaryOperatorSet(operators.build());
		}
	}

	static boolean unwrapBool(Boolean b) {
		return b != null && b.booleanValue();
	}
}
