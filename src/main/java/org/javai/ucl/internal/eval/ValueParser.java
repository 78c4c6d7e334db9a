package org.javai.ucl.internal.eval;

import com.fasterxml.jackson.core.JsonProcessingException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import org.javai.ucl.UclSyntaxException;
import org.javai.ucl.env.EnvironmentSource;
import org.javai.ucl.internal.lex.QuoteTracker;
import org.javai.ucl.value.UclArray;
import org.javai.ucl.value.UclBoolean;
import org.javai.ucl.value.UclJson;
import org.javai.ucl.value.UclNull;
import org.javai.ucl.value.UclNumber;
import org.javai.ucl.value.UclObject;
import org.javai.ucl.value.UclString;
import org.javai.ucl.value.UclValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns the text on the right of an {@code =} into a value.
 * <p>
 * The text is classified by shape, in this order:
 * <ol>
 *   <li>{@code $ENV{NAME}}: an environment lookup, null when unset</li>
 *   <li>a trailing {@code .int}, {@code .float}, {@code .string} or {@code .bool}: a conversion of
 *   the text before it</li>
 *   <li>an operator outside quotes: an expression</li>
 *   <li>a dotted name with optional {@code [..]} accessors: a reference</li>
 *   <li>anything else: a literal</li>
 * </ol>
 * Steps 2 to 4 never apply to text that is already a simple literal, so
 * {@code -5}, {@code "a+b"} and {@code [1, 2]} are taken literally.
 * <p>
 * One instance serves one parse of one document and is not thread-safe.
 */
public class ValueParser {

	private static final Logger logger = LoggerFactory.getLogger(ValueParser.class);

	private final EnvironmentSource environment;
	private final ReferenceResolver references;
	private final ExpressionEvaluator expressions;
	private final int maxNestingDepth;
	private int depth;

	public ValueParser(UclObject document, EnvironmentSource environment, int maxNestingDepth) {
		this.environment = Objects.requireNonNull(environment, "environment must not be null");
		this.references = new ReferenceResolver(document);
		this.expressions = new ExpressionEvaluator(this);
		this.maxNestingDepth = maxNestingDepth;
	}

	/**
	 * Evaluates value text. References are resolved against the document as it
	 * stands, falling back to {@code section} for relative names.
	 */
	public UclValue parse(String text, SectionPath section) {
		String value = text.trim();
		if (value.isEmpty()) {
			return UclNull.INSTANCE;
		}
		if (depth >= maxNestingDepth) {
			throw new UclSyntaxException("Value nesting exceeds maximum depth of " + maxNestingDepth + ": " + value);
		}
		depth++;
		try {
			logger.trace("Evaluating '{}' in section [{}]", value, section);
			return classifyAndEvaluate(value, section);
		} finally {
			depth--;
		}
	}

	private UclValue classifyAndEvaluate(String value, SectionPath section) {
		Optional<UclValue> env = lookupEnvironment(value);
		if (env.isPresent()) {
			return env.get();
		}

		boolean simple = Literals.isSimpleLiteral(value);

		if (!simple && value.indexOf('.') >= 0) {
			int dot = value.lastIndexOf('.');
			Optional<ConversionTarget> target = ConversionTarget.fromSuffix(value.substring(dot + 1));
			if (target.isPresent()) {
				UclValue base = parse(value.substring(0, dot), section);
				return TypeConverter.convert(base, target.get());
			}
		}

		if (!simple && QuoteTracker.containsUnquoted(value, Literals.OPERATORS)) {
			return expressions.evaluate(value, section);
		}

		if (!simple && Literals.REFERENCE.matcher(value).matches()) {
			return references.resolve(value, section);
		}

		return parseLiteral(value, section);
	}

	/**
	 * Evaluates a single expression operand: an environment reference, a
	 * reference, or a literal. Conversions and expressions are not considered.
	 */
	UclValue parseOperand(String text, SectionPath section) {
		String value = text.trim();
		if (value.isEmpty()) {
			return UclNull.INSTANCE;
		}
		if (Literals.isQuoted(value)) {
			return new UclString(Literals.unescape(value.substring(1, value.length() - 1)));
		}
		Optional<UclValue> env = lookupEnvironment(value);
		if (env.isPresent()) {
			return env.get();
		}
		if (Literals.isReference(value)) {
			return references.resolve(value, section);
		}
		return parseLiteral(value, section);
	}

	/**
	 * Materialises literal text: null, booleans, quoted strings, arrays, JSON
	 * objects and decimal numbers. Anything else is kept as an unquoted string.
	 *
	 * @throws UclSyntaxException if braced text is not a valid JSON object
	 */
	UclValue parseLiteral(String value, SectionPath section) {
		String lower = value.toLowerCase(Locale.ROOT);
		if (lower.equals("null")) {
			return UclNull.INSTANCE;
		}
		if (lower.equals("true") || lower.equals("false")) {
			return UclBoolean.of(lower.equals("true"));
		}
		if (Literals.isQuoted(value)) {
			return new UclString(Literals.unescape(value.substring(1, value.length() - 1)));
		}
		if (value.startsWith("[") && value.endsWith("]")) {
			return parseArray(value, section);
		}
		if (value.startsWith("{") && value.endsWith("}")) {
			return parseObject(value);
		}
		if (Literals.isNumber(value)) {
			return new UclNumber(Double.parseDouble(value));
		}
		return new UclString(value);
	}

	private UclArray parseArray(String value, SectionPath section) {
		List<UclValue> elements = new ArrayList<>();
		for (String element : Literals.splitArrayElements(value.substring(1, value.length() - 1))) {
			elements.add(parse(element, section));
		}
		return new UclArray(elements);
	}

	private UclValue parseObject(String value) {
		try {
			return UclJson.readStrict(value);
		} catch (JsonProcessingException e) {
			throw new UclSyntaxException("Invalid JSON object: " + e.getOriginalMessage() + " in '" + value + "'", e);
		}
	}

	private Optional<UclValue> lookupEnvironment(String value) {
		Matcher matcher = Literals.ENV_REFERENCE.matcher(value);
		if (!matcher.matches()) {
			return Optional.empty();
		}
		String name = matcher.group(1);
		UclValue resolved = environment.lookup(name)
				.<UclValue>map(UclString::new)
				.orElse(UclNull.INSTANCE);
		logger.trace("Environment variable {} resolved to {}", name, resolved.isNull() ? "null" : "a value");
		return Optional.of(resolved);
	}
}
