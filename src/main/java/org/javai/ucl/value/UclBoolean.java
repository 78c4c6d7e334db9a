package org.javai.ucl.value;

public record UclBoolean(boolean value) implements UclValue {

	public static final UclBoolean TRUE = new UclBoolean(true);
	public static final UclBoolean FALSE = new UclBoolean(false);

	public static UclBoolean of(boolean value) {
		return value ? TRUE : FALSE;
	}

	@Override
	public Kind kind() {
		return Kind.BOOLEAN;
	}

	@Override
	public Object toJava() {
		return value;
	}

	@Override
	public String toString() {
		return Boolean.toString(value);
	}
}
