package org.javai.ucl;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.javai.ucl.internal.eval.Literals;
import org.javai.ucl.value.UclArray;
import org.javai.ucl.value.UclBoolean;
import org.javai.ucl.value.UclJson;
import org.javai.ucl.value.UclNumber;
import org.javai.ucl.value.UclObject;
import org.javai.ucl.value.UclString;
import org.javai.ucl.value.UclValue;

/**
 * Renders a document back to UCL text.
 * <p>
 * Root-level values come first, followed by one {@code [dotted.section]} block
 * per nested object. A section holding only child sections gets no header of
 * its own. Empty objects and objects inside arrays are written inline as JSON.
 * An object is also written inline when a section would not read back as the
 * same object: a root-level {@code defaults} key, or any key that starts a line
 * the way an {@code include} directive does.
 * Keys are written as-is, so keys containing dots, brackets or {@code =} do not
 * survive a round trip.
 */
public class UclPrettyPrinter {

	private final StringBuilder output = new StringBuilder();

	/**
	 * Appends the rendering of {@code document} to this printer's output.
	 */
	public UclPrettyPrinter append(UclObject document) {
		printSection(new ArrayList<>(), document);
		return this;
	}

	private void printSection(List<String> path, UclObject section) {
		List<Map.Entry<String, UclValue>> values = new ArrayList<>();
		List<Map.Entry<String, UclValue>> children = new ArrayList<>();
		for (Map.Entry<String, UclValue> entry : section.entries().entrySet()) {
			if (isSection(path, entry.getKey(), entry.getValue())) {
				children.add(entry);
			} else {
				values.add(entry);
			}
		}

		if (!path.isEmpty() && !values.isEmpty()) {
			if (output.length() > 0) {
				output.append('\n');
			}
			output.append('[').append(String.join(".", path)).append("]\n");
		}
		for (Map.Entry<String, UclValue> entry : values) {
			output.append(entry.getKey()).append(" = ").append(literal(entry.getValue())).append('\n');
		}
		for (Map.Entry<String, UclValue> child : children) {
			path.add(child.getKey());
			printSection(path, (UclObject) child.getValue());
			path.remove(path.size() - 1);
		}
	}

	private static boolean isSection(List<String> parentPath, String key, UclValue value) {
		if (!(value instanceof UclObject object) || object.isEmpty()) {
			return false;
		}
		if (parentPath.isEmpty() && key.equalsIgnoreCase("defaults")) {
			return false;
		}
		return object.entries().keySet().stream().noneMatch(UclPrettyPrinter::readsAsInclude);
	}

	// Mirrors the directive test applied to trimmed lines before assembly.
	private static boolean readsAsInclude(String key) {
		String line = (key + " = ").strip();
		return line.startsWith("include") && line.length() > 7 && Character.isWhitespace(line.charAt(7));
	}

	/**
	 * Renders a single value as it would appear to the right of {@code =}.
	 */
	public static String literal(UclValue value) {
		if (value instanceof UclString string) {
			return Literals.quote(string.value());
		}
		if (value instanceof UclNumber number) {
			return number.toCanonicalString();
		}
		if (value instanceof UclBoolean bool) {
			return String.valueOf(bool.value());
		}
		if (value instanceof UclArray array) {
			return array.elements().stream()
					.map(UclPrettyPrinter::literal)
					.collect(Collectors.joining(", ", "[", "]"));
		}
		if (value instanceof UclObject) {
			return UclJson.toJsonString(value);
		}
		return "null";
	}

	/**
	 * Returns the rendered text.
	 */
	@Override
	public String toString() {
		return output.toString();
	}

	/**
	 * Static convenience method to render a document.
	 */
	public static String print(UclObject document) {
		return new UclPrettyPrinter().append(document).toString();
	}
}
