package org.javai.ucl.internal.lex;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Removes comments from document text.
 * <p>
 * Block comments ({@code /* ... *&#47;}) are removed first, matched
 * non-greedily across lines. The line breaks a block comment spans are kept so
 * that the line count of the text does not change. Line comments ({@code //})
 * then cut the rest of their physical line, unless the {@code //} sits inside
 * a quoted string.
 */
public final class CommentStripper {

	private static final Pattern BLOCK_COMMENT = Pattern.compile("/\\*.*?\\*/", Pattern.DOTALL);

	private CommentStripper() {
	}

	public static String strip(String text) {
		if (text == null || text.isEmpty()) {
			return "";
		}
		String withoutBlocks = stripBlockComments(text);
		String[] lines = withoutBlocks.split("\n", -1);
		StringBuilder sb = new StringBuilder(withoutBlocks.length());
		for (int i = 0; i < lines.length; i++) {
			if (i > 0) {
				sb.append('\n');
			}
			sb.append(stripLineComment(lines[i]));
		}
		return sb.toString();
	}

	static String stripBlockComments(String text) {
		Matcher matcher = BLOCK_COMMENT.matcher(text);
		StringBuilder sb = new StringBuilder(text.length());
		while (matcher.find()) {
			String lineBreaks = "\n".repeat((int) matcher.group().chars().filter(c -> c == '\n').count());
			matcher.appendReplacement(sb, lineBreaks);
		}
		matcher.appendTail(sb);
		return sb.toString();
	}

	static String stripLineComment(String line) {
		QuoteTracker tracker = new QuoteTracker();
		for (int i = 0; i < line.length(); i++) {
			boolean quoted = tracker.accept(line, i);
			if (!quoted && line.charAt(i) == '/' && i + 1 < line.length() && line.charAt(i + 1) == '/') {
				return line.substring(0, i);
			}
		}
		return line;
	}
}
