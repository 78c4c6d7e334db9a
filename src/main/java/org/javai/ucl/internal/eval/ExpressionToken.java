package org.javai.ucl.internal.eval;

/**
 * A token of an arithmetic or concatenation expression.
 *
 * @param type the token type
 * @param text the token text; for {@link Type#STRING} the unescaped content
 * @param position the character position in the expression
 */
public record ExpressionToken(Type type, String text, int position) {

	public enum Type {
		OPERAND,     // literals, references, $ENV{...}
		STRING,      // "quoted" or 'quoted'
		OPERATOR,    // + - * / %
		LPAREN,      // (
		RPAREN       // )
	}

	public boolean isType(Type expectedType) {
		return type == expectedType;
	}

	@Override
	public String toString() {
		return switch (type) {
			case STRING -> "STRING('" + text + "')";
			case OPERAND, OPERATOR -> type + "(" + text + ")";
			default -> type.toString();
		};
	}
}
