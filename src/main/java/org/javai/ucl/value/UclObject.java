package org.javai.ucl.value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * A string-keyed mapping of values.
 * <p>
 * Unlike the other value kinds an object is mutable: the parser builds the
 * document by inserting into it. Iteration follows insertion order, which only
 * matters when the object is rendered back to text.
 */
public final class UclObject implements UclValue {

	private final Map<String, UclValue> entries = new LinkedHashMap<>();

	public UclObject() {
	}

	public UclObject(Map<String, ? extends UclValue> entries) {
		entries.forEach(this::put);
	}

	@Override
	public Kind kind() {
		return Kind.OBJECT;
	}

	/**
	 * Returns the value stored under {@code key}, or {@code null} when the key
	 * is absent. A key holding {@link UclNull} returns that instance.
	 */
	public UclValue get(String key) {
		return entries.get(key);
	}

	public Optional<UclValue> find(String key) {
		return Optional.ofNullable(entries.get(key));
	}

	public boolean containsKey(String key) {
		return entries.containsKey(key);
	}

	public void put(String key, UclValue value) {
		Objects.requireNonNull(key, "key must not be null");
		Objects.requireNonNull(value, "value must not be null");
		entries.put(key, value);
	}

	public UclValue remove(String key) {
		return entries.remove(key);
	}

	public Set<String> keySet() {
		return Collections.unmodifiableSet(entries.keySet());
	}

	public Map<String, UclValue> entries() {
		return Collections.unmodifiableMap(entries);
	}

	public int size() {
		return entries.size();
	}

	public boolean isEmpty() {
		return entries.isEmpty();
	}

	/**
	 * Walks a dotted path ({@code "Network.HTTP.port"}) through nested objects.
	 *
	 * @return the value at the path, or empty if any segment is missing or a
	 * segment other than the last does not hold an object
	 */
	public Optional<UclValue> at(String dottedPath) {
		return at(List.of(dottedPath.split("\\.", -1)));
	}

	public Optional<UclValue> at(List<String> path) {
		UclValue current = this;
		for (String segment : path) {
			if (!(current instanceof UclObject object) || !object.containsKey(segment)) {
				return Optional.empty();
			}
			current = object.get(segment);
		}
		return Optional.of(current);
	}

	/**
	 * Returns the object stored under {@code key}, replacing whatever non-object
	 * value is there with a fresh empty object.
	 */
	public UclObject objectAt(String key) {
		UclValue existing = entries.get(key);
		if (existing instanceof UclObject object) {
			return object;
		}
		UclObject created = new UclObject();
		entries.put(key, created);
		return created;
	}

	/**
	 * Stores {@code value} at the end of {@code path}, creating intermediate
	 * objects and overwriting non-object values found along the way.
	 */
	public void putPath(List<String> path, UclValue value) {
		if (path.isEmpty()) {
			throw new IllegalArgumentException("path must not be empty");
		}
		UclObject current = this;
		for (String segment : path.subList(0, path.size() - 1)) {
			current = current.objectAt(segment);
		}
		current.put(path.get(path.size() - 1), value);
	}

	@Override
	public Map<String, Object> toJava() {
		Map<String, Object> java = new LinkedHashMap<>();
		entries.forEach((key, value) -> java.put(key, value.toJava()));
		return java;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		return o instanceof UclObject other && entries.equals(other.entries);
	}

	@Override
	public int hashCode() {
		return entries.hashCode();
	}

	@Override
	public String toString() {
		return entries.toString();
	}
}
