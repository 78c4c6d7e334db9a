package org.javai.ucl.internal.assemble;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.javai.ucl.UclSyntaxException;
import org.javai.ucl.env.EnvironmentSource;
import org.javai.ucl.internal.eval.SectionPath;
import org.javai.ucl.internal.eval.ValueParser;
import org.javai.ucl.internal.lex.QuoteTracker;
import org.javai.ucl.value.UclObject;
import org.javai.ucl.value.UclValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the document from comment-free, include-expanded lines.
 * <p>
 * Section headers set the current section path; every other non-blank line
 * assigns a value beneath it. A value that opens with <code>{</code> or <code>[</code>
 * continues over the following lines until its brackets balance. Everything
 * after a {@code [Defaults]} header is collected as fallback values, which are
 * applied once the whole document has been assembled.
 * <p>
 * An assembler is single use.
 */
public final class DocumentAssembler {

	private static final Logger logger = LoggerFactory.getLogger(DocumentAssembler.class);

	private static final String DEFAULTS_SECTION = "defaults";
	private static final String STRUCTURE_CHARACTERS = "[]{},\"'";

	private final UclObject document = new UclObject();
	private final DefaultsTable defaults = new DefaultsTable();
	private final ValueParser values;
	private SectionPath section = SectionPath.ROOT;

	public DocumentAssembler(EnvironmentSource environment, int maxNestingDepth) {
		Objects.requireNonNull(environment, "environment must not be null");
		this.values = new ValueParser(document, environment, maxNestingDepth);
	}

	/**
	 * Assembles {@code lines} into a document and applies the defaults block.
	 *
	 * @throws UclSyntaxException if a line is malformed or a section follows the defaults block
	 */
	public UclObject assemble(List<String> lines) {
		logger.debug("Assembling document from {} lines", lines.size());
		int i = 0;
		while (i < lines.size()) {
			String line = lines.get(i).trim();
			if (line.isEmpty()) {
				i++;
				continue;
			}
			if (isSectionHeader(line)) {
				String name = sectionName(line);
				if (name.equalsIgnoreCase(DEFAULTS_SECTION)) {
					assembleDefaults(lines, i + 1);
					break;
				}
				section = SectionPath.parse(name);
				logger.debug("Entering section [{}]", section);
				i++;
				continue;
			}
			i = assign(lines, i);
		}

		if (defaults.size() > 0) {
			logger.debug("Applying {} defaults", defaults.size());
			defaults.applyTo(document);
		}
		return document;
	}

	private int assign(List<String> lines, int index) {
		String line = lines.get(index).trim();
		Optional<KeyValueLine> keyValue = KeyValueLine.split(line);
		if (keyValue.isEmpty()) {
			if (!isStructuredFragment(line)) {
				throw new UclSyntaxException("Invalid syntax: line without equals sign: " + line);
			}
			return index + 1;
		}

		ValueText value = readValue(lines, index, keyValue.get());
		UclValue parsed = values.parse(value.text(), section);
		document.putPath(section.child(keyValue.get().key()), parsed);
		return value.lastLine() + 1;
	}

	private void assembleDefaults(List<String> lines, int start) {
		logger.debug("Entering defaults block");
		int i = start;
		while (i < lines.size()) {
			String line = lines.get(i).trim();
			if (line.isEmpty()) {
				i++;
				continue;
			}
			if (isSectionHeader(line)) {
				throw new UclSyntaxException("Defaults section must be at the end of the document, found: " + line);
			}
			Optional<KeyValueLine> keyValue = KeyValueLine.split(line);
			if (keyValue.isEmpty()) {
				i++;
				continue;
			}
			ValueText value = readValue(lines, i, keyValue.get());
			defaults.put(keyValue.get().key(), values.parse(value.text(), section));
			i = value.lastLine() + 1;
		}
	}

	/**
	 * Reads the value of a key-value line, pulling in continuation lines when the
	 * value opens a multi-line object or array.
	 */
	private ValueText readValue(List<String> lines, int index, KeyValueLine keyValue) {
		if (!keyValue.startsStructuredValue()) {
			return new ValueText(keyValue.value(), index);
		}

		String initial = keyValue.value();
		char open = initial.charAt(0);
		char close = open == '{' ? '}' : ']';
		StringBuilder text = new StringBuilder(initial);
		int balance = balance(initial, open, close);
		int i = index + 1;
		while (i < lines.size() && balance > 0) {
			String line = lines.get(i).trim();
			if (!line.isEmpty()) {
				text.append('\n').append(line);
				balance += balance(line, open, close);
			}
			i++;
		}
		return new ValueText(text.toString(), i - 1);
	}

	private static int balance(String text, char open, char close) {
		QuoteTracker tracker = new QuoteTracker();
		int balance = 0;
		for (int i = 0; i < text.length(); i++) {
			if (tracker.accept(text, i)) {
				continue;
			}
			char c = text.charAt(i);
			if (c == open) {
				balance++;
			}
			else if (c == close) {
				balance--;
			}
		}
		return balance;
	}

	private static boolean isSectionHeader(String line) {
		return line.length() >= 2 && line.startsWith("[") && line.endsWith("]");
	}

	private static String sectionName(String line) {
		return line.substring(1, line.length() - 1).trim();
	}

	/**
	 * Lines without {@code =} are tolerated only when they look like leftovers of
	 * structured data.
	 */
	private static boolean isStructuredFragment(String line) {
		if (line.startsWith("[") || line.endsWith("]") || line.equals("{") || line.equals("}")) {
			return true;
		}
		for (int i = 0; i < line.length(); i++) {
			if (STRUCTURE_CHARACTERS.indexOf(line.charAt(i)) >= 0) {
				return true;
			}
		}
		return false;
	}

	private record ValueText(String text, int lastLine) {
	}
}
