package org.modelform.dict;

import java.util.Objects;

import org.modelform.TypeMismatchException;
import org.modelform.expr.Values;

/** The type of a component: either one of the {@link Primitive} types or a {@link ClassReference} to a class definition */
public abstract class DataType {
	private DataType() {
	}

	/** @return Whether this is a {@link Primitive} type */
	public abstract boolean isPrimitive();

	/** @return The name of this type as it appears in model source and output schemas */
	public abstract String getName();

	@Override
	public String toString() {
		return getName();
	}

	/**
	 * @param name The type specifier from model source
	 * @return The primitive type with the given name, or a class reference to the given path
	 */
	public static DataType of(String name) {
		Primitive prim = Primitive.forName(name);
		return prim != null ? prim : new ClassReference(name);
	}

	/** One of the 4 built-in value types */
	public static final class Primitive extends DataType {
		/** The <code>Boolean</code> type */
		public static final Primitive BOOLEAN = new Primitive("Boolean");
		/** The <code>String</code> type */
		public static final Primitive STRING = new Primitive("String");
		/** The <code>Integer</code> type */
		public static final Primitive INTEGER = new Primitive("Integer");
		/** The <code>Real</code> type */
		public static final Primitive REAL = new Primitive("Real");

		private final String theName;

		private Primitive(String name) {
			theName = name;
		}

		/**
		 * @param name The type name
		 * @return The primitive type with the given name, or null if the name does not denote a primitive
		 */
		public static Primitive forName(String name) {
			if (name == null)
				return null;
			switch (name) {
			case "Boolean":
				return BOOLEAN;
			case "String":
				return STRING;
			case "Integer":
				return INTEGER;
			case "Real":
				return REAL;
			default:
				return null;
			}
		}

		@Override
		public boolean isPrimitive() {
			return true;
		}

		@Override
		public String getName() {
			return theName;
		}

		/**
		 * Converts a value to this type. Integers widen to reals; no other conversions are made.
		 *
		 * @param value The value to convert
		 * @param path The instance path the value is for, for error context
		 * @return The value as this type
		 * @throws TypeMismatchException If the value cannot be represented as this type
		 */
		public Object coerce(Object value, String path) throws TypeMismatchException {
			if (this == BOOLEAN) {
				if (value instanceof Boolean)
					return value;
			} else if (this == STRING) {
				if (value instanceof String)
					return value;
			} else if (value instanceof Number) {
				Object normal = Values.normalize(value);
				if (this == REAL)
					return Double.valueOf(((Number) normal).doubleValue());
				else if (normal instanceof Integer)
					return normal; // Reals are never narrowed, even when integral
			}
			throw new TypeMismatchException(path, "Cannot assign " + Values.describe(value) + " to " + theName);
		}
	}

	/** A reference to a class definition, by its dictionary path */
	public static final class ClassReference extends DataType {
		private final String thePath;

		/** @param path The path of the referenced class definition */
		public ClassReference(String path) {
			thePath = Objects.requireNonNull(path, "path");
		}

		/** @return The path of the referenced class definition */
		public String getPath() {
			return thePath;
		}

		@Override
		public boolean isPrimitive() {
			return false;
		}

		@Override
		public String getName() {
			return thePath;
		}

		@Override
		public int hashCode() {
			return thePath.hashCode();
		}

		@Override
		public boolean equals(Object obj) {
			return obj instanceof ClassReference && thePath.equals(((ClassReference) obj).thePath);
		}
	}
}
