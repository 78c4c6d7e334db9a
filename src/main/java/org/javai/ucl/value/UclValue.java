package org.javai.ucl.value;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * A fully evaluated configuration value.
 * <p>
 * Every value produced by the parser is one of six kinds. Equality between
 * values is purely structural.
 */
public sealed interface UclValue permits UclNull, UclBoolean, UclNumber, UclString, UclArray, UclObject {

	enum Kind {
		NULL,
		BOOLEAN,
		NUMBER,
		STRING,
		ARRAY,
		OBJECT
	}

	Kind kind();

	/**
	 * Converts this value into plain Java objects: {@code null}, {@link Boolean},
	 * {@link Double}, {@link String}, {@link List} and {@link LinkedHashMap}.
	 */
	Object toJava();

	default boolean isNull() {
		return kind() == Kind.NULL;
	}

	default String typeName() {
		return kind().name().toLowerCase(Locale.ROOT);
	}

	/**
	 * Wraps a plain Java object graph as a value. Accepts the types produced by
	 * {@link #toJava()} plus any {@link Number}.
	 *
	 * @throws IllegalArgumentException if the graph contains an unsupported type
	 */
	static UclValue of(Object java) {
		if (java == null) {
			return UclNull.INSTANCE;
		}
		if (java instanceof UclValue value) {
			return value;
		}
		if (java instanceof Boolean bool) {
			return UclBoolean.of(bool);
		}
		if (java instanceof Number number) {
			return new UclNumber(number.doubleValue());
		}
		if (java instanceof CharSequence text) {
			return new UclString(text.toString());
		}
		if (java instanceof List<?> list) {
			return new UclArray(list.stream().map(UclValue::of).toList());
		}
		if (java instanceof Map<?, ?> map) {
			UclObject object = new UclObject();
			map.forEach((key, value) -> object.put(String.valueOf(key), of(value)));
			return object;
		}
		throw new IllegalArgumentException("Unsupported value type: " + java.getClass().getName());
	}
}
