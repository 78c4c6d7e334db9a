package org.javai.ucl.internal.eval;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import org.javai.ucl.internal.lex.QuoteTracker;
import org.javai.ucl.value.UclJson;

/**
 * Lexical shapes of value text: what counts as a number, a quoted string, a
 * reference, or a simple literal.
 */
public final class Literals {

	public static final String OPERATORS = "+-*/%";

	static final Pattern NUMBER = Pattern.compile("-?\\d+(\\.\\d+)?");

	static final Pattern ENV_REFERENCE = Pattern.compile("\\$ENV\\{([^}]+)}");

	static final Pattern REFERENCE = Pattern.compile(
			"[a-zA-Z_$][a-zA-Z0-9_$]*(\\.[a-zA-Z_$][a-zA-Z0-9_$]*)*(\\[\\s*(?:'[^']*'|\"[^\"]*\"|\\d+)\\s*])*");

	private Literals() {
	}

	/**
	 * Returns whether {@code text} is a plain decimal number such as {@code 42},
	 * {@code -7} or {@code 3.14}. Exponent notation is not a number.
	 */
	public static boolean isNumber(String text) {
		return NUMBER.matcher(text).matches() && Double.isFinite(Double.parseDouble(text));
	}

	public static boolean isQuoted(String text) {
		if (text.length() < 2) {
			return false;
		}
		char first = text.charAt(0);
		return (first == '"' || first == '\'') && text.charAt(text.length() - 1) == first;
	}

	public static boolean isKeyword(String text) {
		String lower = text.toLowerCase(Locale.ROOT);
		return lower.equals("null") || lower.equals("true") || lower.equals("false");
	}

	/**
	 * Returns whether {@code text} can be taken literally, without expression,
	 * conversion or reference evaluation.
	 */
	public static boolean isSimpleLiteral(String text) {
		String trimmed = text.trim();
		if (isQuoted(trimmed)) {
			return !QuoteTracker.containsUnquoted(trimmed, OPERATORS);
		}
		if ((trimmed.startsWith("[") && trimmed.endsWith("]"))
				|| (trimmed.startsWith("{") && trimmed.endsWith("}"))) {
			return UclJson.isStrictJson(trimmed);
		}
		return isKeyword(trimmed) || isNumber(trimmed);
	}

	public static boolean isReference(String text) {
		return !isSimpleLiteral(text) && REFERENCE.matcher(text).matches();
	}

	/**
	 * Resolves backslash escapes in the body of a quoted string. Recognised
	 * escapes are {@code \n \t \r \\ \" \'}; any other backslash is kept as is.
	 */
	public static String unescape(String body) {
		StringBuilder sb = new StringBuilder(body.length());
		int i = 0;
		while (i < body.length()) {
			char c = body.charAt(i);
			if (c == '\\' && i + 1 < body.length()) {
				char next = body.charAt(i + 1);
				String replacement = switch (next) {
					case 'n' -> "\n";
					case 't' -> "\t";
					case 'r' -> "\r";
					case '\\' -> "\\";
					case '"' -> "\"";
					case '\'' -> "'";
					default -> null;
				};
				if (replacement != null) {
					sb.append(replacement);
					i += 2;
					continue;
				}
			}
			sb.append(c);
			i++;
		}
		return sb.toString();
	}

	/**
	 * Renders {@code value} as a double-quoted literal that {@link #unescape}
	 * turns back into the same string.
	 */
	public static String quote(String value) {
		StringBuilder sb = new StringBuilder(value.length() + 2).append('"');
		for (int i = 0; i < value.length(); i++) {
			char c = value.charAt(i);
			switch (c) {
				case '\\' -> sb.append("\\\\");
				case '"' -> sb.append("\\\"");
				case '\n' -> sb.append("\\n");
				case '\t' -> sb.append("\\t");
				case '\r' -> sb.append("\\r");
				default -> sb.append(c);
			}
		}
		return sb.append('"').toString();
	}

	/**
	 * Splits the content of an array literal (without the outer brackets) on
	 * the commas that sit outside nested arrays, objects and strings. Blank
	 * segments are dropped.
	 */
	public static List<String> splitArrayElements(String content) {
		List<String> elements = new ArrayList<>();
		String flattened = content.replaceAll("\\s*\n\\s*", " ");
		QuoteTracker tracker = new QuoteTracker();
		StringBuilder current = new StringBuilder();
		int brackets = 0;
		int braces = 0;
		for (int i = 0; i < flattened.length(); i++) {
			char c = flattened.charAt(i);
			if (!tracker.accept(flattened, i)) {
				switch (c) {
					case '[' -> brackets++;
					case ']' -> brackets--;
					case '{' -> braces++;
					case '}' -> braces--;
					case ',' -> {
						if (brackets == 0 && braces == 0) {
							addElement(elements, current);
							current.setLength(0);
							continue;
						}
					}
					default -> {
					}
				}
			}
			current.append(c);
		}
		addElement(elements, current);
		return elements;
	}

	private static void addElement(List<String> elements, StringBuilder element) {
		String trimmed = element.toString().trim();
		if (!trimmed.isEmpty()) {
			elements.add(trimmed);
		}
	}
}
