package org.javai.ucl.internal.eval;

import java.util.ArrayList;
import java.util.List;
import org.javai.ucl.UclSyntaxException;
import org.javai.ucl.internal.lex.QuoteTracker;

/**
 * Splits an expression into operands, operators and parentheses.
 * <p>
 * Whitespace separates tokens and is otherwise ignored. A quoted span is a
 * single string token. A {@code -} directly followed by a digit is the sign of
 * a number when it opens the expression or follows an operator or {@code (}.
 * Quotes inside the bracketed accessors of a reference ({@code users[0]["name"]})
 * belong to the reference.
 */
public class ExpressionTokenizer {

	private static final String DELIMITERS = "()+-*/%\"'";

	private final String input;
	private final List<ExpressionToken> tokens = new ArrayList<>();
	private int pos = 0;

	public ExpressionTokenizer(String input) {
		this.input = input != null ? input : "";
	}

	/**
	 * Tokenizes the entire expression.
	 *
	 * @throws UclSyntaxException if a quoted string is not terminated
	 */
	public List<ExpressionToken> tokenize() {
		while (!isAtEnd()) {
			skipWhitespace();
			if (isAtEnd()) break;

			tokens.add(nextToken());
		}
		return List.copyOf(tokens);
	}

	private ExpressionToken nextToken() {
		int start = pos;
		char c = peek();

		return switch (c) {
			case '(' -> {
				advance();
				yield new ExpressionToken(ExpressionToken.Type.LPAREN, "(", start);
			}
			case ')' -> {
				advance();
				yield new ExpressionToken(ExpressionToken.Type.RPAREN, ")", start);
			}
			case '"', '\'' -> scanString();
			case '+', '*', '/', '%' -> {
				advance();
				yield new ExpressionToken(ExpressionToken.Type.OPERATOR, String.valueOf(c), start);
			}
			case '-' -> {
				if (isSignPosition() && pos + 1 < input.length() && isDigit(input.charAt(pos + 1))) {
					advance(); // consume sign
					yield scanOperand(start);
				}
				advance();
				yield new ExpressionToken(ExpressionToken.Type.OPERATOR, "-", start);
			}
			default -> scanOperand(start);
		};
	}

	private ExpressionToken scanString() {
		int start = pos;
		char quote = advance();

		while (!isAtEnd()) {
			char c = advance();
			if (c == '\\') {
				if (!isAtEnd()) {
					advance();
				}
				continue;
			}
			if (c == quote) {
				String body = input.substring(start + 1, pos - 1);
				return new ExpressionToken(ExpressionToken.Type.STRING, Literals.unescape(body), start);
			}
		}
		throw new UclSyntaxException("Unterminated string at position " + start + " in expression: " + input);
	}

	private ExpressionToken scanOperand(int start) {
		QuoteTracker accessorQuotes = new QuoteTracker();
		int brackets = 0;

		while (!isAtEnd()) {
			char c = peek();
			if (brackets > 0) {
				boolean quoted = accessorQuotes.accept(input, pos);
				if (!quoted && c == ']') {
					brackets--;
				}
			}
			else if (c == '[') {
				brackets++;
				accessorQuotes.reset();
			}
			else if (isWhitespace(c) || DELIMITERS.indexOf(c) >= 0) {
				break;
			}
			advance();
		}

		return new ExpressionToken(ExpressionToken.Type.OPERAND, input.substring(start, pos), start);
	}

	private boolean isSignPosition() {
		if (tokens.isEmpty()) {
			return true;
		}
		ExpressionToken previous = tokens.get(tokens.size() - 1);
		return previous.isType(ExpressionToken.Type.OPERATOR) || previous.isType(ExpressionToken.Type.LPAREN);
	}

	private void skipWhitespace() {
		while (!isAtEnd() && isWhitespace(peek())) {
			advance();
		}
	}

	private char peek() {
		return isAtEnd() ? '\0' : input.charAt(pos);
	}

	private char advance() {
		return input.charAt(pos++);
	}

	private boolean isAtEnd() {
		return pos >= input.length();
	}

	private boolean isWhitespace(char c) {
		return Character.isWhitespace(c);
	}

	private boolean isDigit(char c) {
		return c >= '0' && c <= '9';
	}
}
