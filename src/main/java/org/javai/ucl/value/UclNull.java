package org.javai.ucl.value;

/**
 * The null value.
 */
public record UclNull() implements UclValue {

	public static final UclNull INSTANCE = new UclNull();

	@Override
	public Kind kind() {
		return Kind.NULL;
	}

	@Override
	public Object toJava() {
		return null;
	}

	@Override
	public String toString() {
		return "null";
	}
}
