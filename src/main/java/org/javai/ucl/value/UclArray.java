package org.javai.ucl.value;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * An ordered, heterogeneous list of values. Arrays are immutable once built.
 */
public record UclArray(List<UclValue> elements) implements UclValue {

	public UclArray {
		elements = List.copyOf(elements);
	}

	public static UclArray of(UclValue... elements) {
		return new UclArray(Arrays.asList(elements));
	}

	@Override
	public Kind kind() {
		return Kind.ARRAY;
	}

	public int size() {
		return elements.size();
	}

	public UclValue get(int index) {
		return elements.get(index);
	}

	@Override
	public Object toJava() {
		// Collectors.toList tolerates the null elements that UclNull maps to
		return elements.stream().map(UclValue::toJava).collect(Collectors.toList());
	}

	@Override
	public String toString() {
		return elements.toString();
	}
}
