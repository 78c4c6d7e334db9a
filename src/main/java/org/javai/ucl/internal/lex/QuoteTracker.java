package org.javai.ucl.internal.lex;

/**
 * Tracks whether a left-to-right scan over a line is inside a quoted string.
 * <p>
 * Double and single quotes are independent quote kinds: a {@code '} inside a
 * double-quoted span is plain text and vice versa. Inside a span a backslash
 * escapes the next character, so {@code \"} stays open while {@code \\"}
 * closes.
 */
public final class QuoteTracker {

	private char quote;
	private boolean escaped;

	/**
	 * Feeds the character at {@code index}. Must be called for every index in
	 * order.
	 *
	 * @return {@code true} if the character belongs to a quoted span, including
	 * the opening and closing quote characters themselves
	 */
	public boolean accept(CharSequence text, int index) {
		char c = text.charAt(index);
		if (quote == 0) {
			if (c == '"' || c == '\'') {
				quote = c;
				return true;
			}
			return false;
		}
		if (escaped) {
			escaped = false;
		} else if (c == '\\') {
			escaped = true;
		} else if (c == quote) {
			quote = 0;
		}
		return true;
	}

	public boolean inQuote() {
		return quote != 0;
	}

	public void reset() {
		quote = 0;
		escaped = false;
	}

	/**
	 * Returns the index of the first occurrence of {@code target} outside any
	 * quoted span, or -1.
	 */
	public static int indexOfUnquoted(CharSequence text, char target) {
		QuoteTracker tracker = new QuoteTracker();
		for (int i = 0; i < text.length(); i++) {
			if (!tracker.accept(text, i) && text.charAt(i) == target) {
				return i;
			}
		}
		return -1;
	}

	/**
	 * Returns whether any of {@code targets} occurs outside a quoted span.
	 */
	public static boolean containsUnquoted(CharSequence text, String targets) {
		QuoteTracker tracker = new QuoteTracker();
		for (int i = 0; i < text.length(); i++) {
			if (!tracker.accept(text, i) && targets.indexOf(text.charAt(i)) >= 0) {
				return true;
			}
		}
		return false;
	}
}
