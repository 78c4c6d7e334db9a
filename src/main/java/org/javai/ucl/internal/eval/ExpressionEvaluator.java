package org.javai.ucl.internal.eval;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.javai.ucl.UclSyntaxException;
import org.javai.ucl.UclTypeException;
import org.javai.ucl.value.UclNull;
import org.javai.ucl.value.UclNumber;
import org.javai.ucl.value.UclString;
import org.javai.ucl.value.UclValue;

/**
 * Evaluates arithmetic and concatenation expressions.
 * <p>
 * Parenthesised groups are evaluated innermost-rightmost first and each group
 * is replaced by its result. The remaining flat expression is reduced in two
 * left-to-right passes: {@code * / %} first, then {@code + -}. {@code +}
 * concatenates when either side is a string and adds otherwise; every other
 * operator is numeric.
 */
public class ExpressionEvaluator {

	private final ValueParser values;

	public ExpressionEvaluator(ValueParser values) {
		this.values = Objects.requireNonNull(values, "values must not be null");
	}

	/**
	 * Evaluates {@code expression} with references resolved from {@code section}.
	 *
	 * @throws UclSyntaxException if parentheses are mismatched or an operand is missing
	 * @throws UclTypeException if an operand is not numeric or a divisor is zero
	 */
	public UclValue evaluate(String expression, SectionPath section) {
		List<Term> terms = new ArrayList<>();
		for (ExpressionToken token : new ExpressionTokenizer(expression).tokenize()) {
			terms.add(Term.of(token));
		}

		int open;
		while ((open = lastOpenParen(terms)) >= 0) {
			int close = nextCloseParen(terms, open);
			if (close < 0) {
				throw new UclSyntaxException("Mismatched parentheses in expression: " + expression);
			}
			List<Term> group = terms.subList(open, close + 1);
			UclValue result = evaluateFlat(new ArrayList<>(group.subList(1, group.size() - 1)), expression, section);
			group.clear();
			terms.add(open, Term.computed(result));
		}
		if (terms.stream().anyMatch(term -> term.isToken(ExpressionToken.Type.RPAREN))) {
			throw new UclSyntaxException("Mismatched parentheses in expression: " + expression);
		}
		return evaluateFlat(terms, expression, section);
	}

	private UclValue evaluateFlat(List<Term> terms, String expression, SectionPath section) {
		List<Term> resolved = new ArrayList<>(terms.size());
		for (Term term : terms) {
			resolved.add(term.isOperand() ? Term.computed(resolveOperand(term.token(), section)) : term);
		}

		List<Term> reduced = reduce(resolved, "*/%", expression);
		reduced = reduce(reduced, "+-", expression);

		if (reduced.isEmpty()) {
			return UclNull.INSTANCE;
		}
		if (reduced.size() > 1 || reduced.get(0).value() == null) {
			throw new UclSyntaxException("Malformed expression: " + expression);
		}
		return reduced.get(0).value();
	}

	private List<Term> reduce(List<Term> terms, String operators, String expression) {
		List<Term> output = new ArrayList<>(terms.size());
		for (int i = 0; i < terms.size(); i++) {
			Term term = terms.get(i);
			char operator = term.operator();
			if (operator == 0 || operators.indexOf(operator) < 0) {
				output.add(term);
				continue;
			}
			if (output.isEmpty() || output.get(output.size() - 1).value() == null) {
				throw new UclSyntaxException("Missing left operand for operator '" + operator + "' in: " + expression);
			}
			if (i + 1 >= terms.size() || terms.get(i + 1).value() == null) {
				throw new UclSyntaxException("Missing right operand for operator '" + operator + "' in: " + expression);
			}
			UclValue left = output.remove(output.size() - 1).value();
			UclValue right = terms.get(++i).value();
			output.add(Term.computed(apply(operator, left, right)));
		}
		return output;
	}

	static UclValue apply(char operator, UclValue left, UclValue right) {
		if (operator == '+' && (left instanceof UclString || right instanceof UclString)) {
			return new UclString(TypeConverter.toText(left) + TypeConverter.toText(right));
		}
		double a = TypeConverter.toNumber(left);
		double b = TypeConverter.toNumber(right);
		return switch (operator) {
			case '+' -> new UclNumber(a + b);
			case '-' -> new UclNumber(a - b);
			case '*' -> new UclNumber(a * b);
			case '/' -> {
				if (b == 0) {
					throw new UclTypeException("Division by zero");
				}
				yield new UclNumber(a / b);
			}
			case '%' -> {
				if (b == 0) {
					throw new UclTypeException("Modulo by zero");
				}
				yield new UclNumber(a % b);
			}
			default -> throw new IllegalArgumentException("Unknown operator: " + operator);
		};
	}

	/**
	 * Operands are single tokens: a quoted string, an environment reference, a
	 * reference, or a simple literal. Conversions and nested expressions are
	 * not operands.
	 */
	private UclValue resolveOperand(ExpressionToken token, SectionPath section) {
		if (token.isType(ExpressionToken.Type.STRING)) {
			return new UclString(token.text());
		}
		return values.parseOperand(token.text(), section);
	}

	private static int lastOpenParen(List<Term> terms) {
		for (int i = terms.size() - 1; i >= 0; i--) {
			if (terms.get(i).isToken(ExpressionToken.Type.LPAREN)) {
				return i;
			}
		}
		return -1;
	}

	private static int nextCloseParen(List<Term> terms, int open) {
		for (int i = open + 1; i < terms.size(); i++) {
			if (terms.get(i).isToken(ExpressionToken.Type.RPAREN)) {
				return i;
			}
		}
		return -1;
	}

	/**
	 * Either a token still to be evaluated or a value already computed.
	 */
	private record Term(ExpressionToken token, UclValue value) {

		static Term of(ExpressionToken token) {
			return new Term(token, null);
		}

		static Term computed(UclValue value) {
			return new Term(null, value);
		}

		boolean isToken(ExpressionToken.Type type) {
			return token != null && token.isType(type);
		}

		boolean isOperand() {
			return isToken(ExpressionToken.Type.OPERAND) || isToken(ExpressionToken.Type.STRING);
		}

		char operator() {
			return isToken(ExpressionToken.Type.OPERATOR) ? token.text().charAt(0) : 0;
		}
	}
}
