package org.javai.ucl.value;

import java.util.Objects;

public record UclString(String value) implements UclValue {

	public UclString {
		Objects.requireNonNull(value, "value must not be null");
	}

	@Override
	public Kind kind() {
		return Kind.STRING;
	}

	@Override
	public Object toJava() {
		return value;
	}

	@Override
	public String toString() {
		return value;
	}
}
