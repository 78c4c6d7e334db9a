package org.javai.ucl.internal.eval;

import java.util.ArrayList;
import java.util.List;

/**
 * The dotted nesting context set by the most recent section header, such as
 * {@code [Network.HTTP.CORS]}. Keys are stored beneath it and relative
 * references are looked up from it.
 */
public record SectionPath(List<String> segments) {

	public static final SectionPath ROOT = new SectionPath(List.of());

	public SectionPath {
		segments = List.copyOf(segments);
	}

	/**
	 * Parses a section header name. The name is split on every {@code .}; the
	 * segments are not otherwise validated.
	 */
	public static SectionPath parse(String dottedName) {
		return new SectionPath(List.of(dottedName.split("\\.", -1)));
	}

	public boolean isRoot() {
		return segments.isEmpty();
	}

	/**
	 * Returns the full path of {@code key} within this section.
	 */
	public List<String> child(String key) {
		List<String> path = new ArrayList<>(segments.size() + 1);
		path.addAll(segments);
		path.add(key);
		return path;
	}

	@Override
	public String toString() {
		return String.join(".", segments);
	}
}
