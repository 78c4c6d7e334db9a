package org.javai.ucl.internal.eval;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.javai.ucl.UclReferenceException;
import org.javai.ucl.UclSyntaxException;
import org.javai.ucl.value.UclArray;
import org.javai.ucl.value.UclObject;
import org.javai.ucl.value.UclValue;

/**
 * Resolves references such as {@code Database.host} or
 * {@code Data.users[0]["name"]} against the document built so far.
 * <p>
 * A dotted name is looked up from the document root first and, failing that,
 * from the current section. Only values assigned before the reference is
 * evaluated can be found.
 */
public class ReferenceResolver {

	private static final Pattern COMPLEX_PART = Pattern.compile("([^\\[.]+)|(\\.[^\\[.]+)|(\\[[^\\]]+\\])");
	private static final Pattern INDEX = Pattern.compile("-?\\d+");

	private final UclObject document;

	public ReferenceResolver(UclObject document) {
		this.document = Objects.requireNonNull(document, "document must not be null");
	}

	/**
	 * @throws UclReferenceException if the reference cannot be resolved
	 * @throws UclSyntaxException if a bracketed reference is malformed
	 */
	public UclValue resolve(String reference, SectionPath section) {
		if (reference.indexOf('[') >= 0 || reference.indexOf(']') >= 0) {
			return resolveComplex(reference, section);
		}
		return resolveSimple(reference, section);
	}

	UclValue resolveSimple(String reference, SectionPath section) {
		List<String> path = List.of(reference.split("\\.", -1));
		return lookupAbsolute(path)
				.or(() -> lookupRelative(path, section))
				.orElseThrow(() -> new UclReferenceException("Cannot resolve reference: " + reference));
	}

	private Optional<UclValue> lookupAbsolute(List<String> path) {
		return document.at(path);
	}

	private Optional<UclValue> lookupRelative(List<String> path, SectionPath section) {
		if (section.isRoot()) {
			return Optional.empty();
		}
		return document.at(section.segments())
				.flatMap(base -> base instanceof UclObject object ? object.at(path) : Optional.empty());
	}

	private UclValue resolveComplex(String reference, SectionPath section) {
		List<String> parts = splitComplex(reference);

		UclValue current = resolveSimple(parts.get(0), section);
		for (String part : parts.subList(1, parts.size())) {
			if (part.startsWith("[")) {
				current = access(current, part.substring(1, part.length() - 1).trim(), reference);
			}
			else {
				current = member(current, part.substring(1), reference);
			}
		}
		return current;
	}

	/**
	 * Splits a bracketed reference into its leading name, {@code .name} members
	 * and {@code [accessor]} parts. The parts must cover the whole reference.
	 */
	static List<String> splitComplex(String reference) {
		Matcher matcher = COMPLEX_PART.matcher(reference);
		List<String> parts = new ArrayList<>();
		int end = 0;
		while (matcher.find()) {
			if (matcher.start() != end) {
				break;
			}
			parts.add(matcher.group());
			end = matcher.end();
		}
		if (parts.isEmpty() || end != reference.length() || parts.get(0).startsWith("[")) {
			throw new UclSyntaxException("Invalid complex reference format: " + reference);
		}
		String first = parts.get(0);
		if (first.startsWith(".")) {
			parts.set(0, first.substring(1));
		}
		return parts;
	}

	private UclValue member(UclValue current, String key, String reference) {
		if (!(current instanceof UclObject object)) {
			throw new UclReferenceException("Attempted to access key '" + key + "' on a non-object "
					+ current.typeName() + " value in '" + reference + "'");
		}
		if (!object.containsKey(key)) {
			throw new UclReferenceException("Object key not found: '" + key + "' in '" + reference + "'");
		}
		return object.get(key);
	}

	private UclValue access(UclValue current, String accessor, String reference) {
		if (INDEX.matcher(accessor).matches()) {
			if (!(current instanceof UclArray array)) {
				throw new UclReferenceException("Attempted to index a non-array " + current.typeName()
						+ " value with index " + accessor + " in '" + reference + "'");
			}
			int index = parseIndex(accessor, reference);
			if (index < 0 || index >= array.size()) {
				throw new UclReferenceException("Array index out of bounds: " + accessor + " in '" + reference + "'");
			}
			return array.get(index);
		}
		String key = accessor.replaceAll("^['\"]|['\"]$", "");
		return member(current, key, reference);
	}

	private static int parseIndex(String accessor, String reference) {
		try {
			return Integer.parseInt(accessor);
		}
		catch (NumberFormatException e) {
			throw new UclReferenceException("Array index out of bounds: " + accessor + " in '" + reference + "'");
		}
	}
}
