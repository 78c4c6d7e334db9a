package org.javai.ucl.internal.eval;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import org.javai.ucl.UclTypeException;
import org.javai.ucl.value.UclBoolean;
import org.javai.ucl.value.UclJson;
import org.javai.ucl.value.UclNull;
import org.javai.ucl.value.UclNumber;
import org.javai.ucl.value.UclString;
import org.javai.ucl.value.UclValue;

/**
 * Explicit value conversions requested with a {@code .int}, {@code .float},
 * {@code .string} or {@code .bool} suffix, plus the number and text coercions
 * that expressions rely on.
 */
public final class TypeConverter {

	private static final Set<String> TRUE_WORDS = Set.of("true", "yes", "1");
	private static final Set<String> FALSE_WORDS = Set.of("false", "no", "0");

	private TypeConverter() {
	}

	public static UclValue convert(UclValue value, ConversionTarget target) {
		return switch (target) {
			case INT -> toInt(value);
			case FLOAT -> toFloat(value);
			case STRING -> new UclString(toText(value));
			case BOOL -> toBool(value);
		};
	}

	/**
	 * Truncates toward zero. Numeric strings are parsed first and null becomes 0.
	 */
	static UclNumber toInt(UclValue value) {
		double number = switch (value.kind()) {
			case NUMBER -> ((UclNumber) value).value();
			case STRING -> parseNumeric((UclString) value)
					.orElseThrow(() -> cannotConvert(value, ConversionTarget.INT));
			case NULL -> 0;
			default -> throw cannotConvert(value, ConversionTarget.INT);
		};
		return new UclNumber(number < 0 ? Math.ceil(number) : Math.floor(number));
	}

	static UclNumber toFloat(UclValue value) {
		return switch (value.kind()) {
			case NUMBER -> (UclNumber) value;
			case STRING -> new UclNumber(parseNumeric((UclString) value)
					.orElseThrow(() -> cannotConvert(value, ConversionTarget.FLOAT)));
			case NULL -> new UclNumber(0.0);
			default -> throw cannotConvert(value, ConversionTarget.FLOAT);
		};
	}

	static UclBoolean toBool(UclValue value) {
		return switch (value.kind()) {
			case BOOLEAN -> (UclBoolean) value;
			case NUMBER -> UclBoolean.of(((UclNumber) value).value() != 0);
			case NULL -> UclBoolean.FALSE;
			case STRING -> {
				String word = ((UclString) value).value().toLowerCase(Locale.ROOT);
				if (TRUE_WORDS.contains(word)) {
					yield UclBoolean.TRUE;
				}
				if (FALSE_WORDS.contains(word)) {
					yield UclBoolean.FALSE;
				}
				throw new UclTypeException("Cannot convert string '" + ((UclString) value).value() + "' to bool");
			}
			default -> throw cannotConvert(value, ConversionTarget.BOOL);
		};
	}

	/**
	 * Canonical text of a value: booleans as {@code true}/{@code false}, null as
	 * {@code null}, integral numbers without a fractional part, arrays and
	 * objects as compact JSON.
	 */
	public static String toText(UclValue value) {
		return switch (value.kind()) {
			case NULL -> "null";
			case BOOLEAN -> Boolean.toString(((UclBoolean) value).value());
			case NUMBER -> ((UclNumber) value).toCanonicalString();
			case STRING -> ((UclString) value).value();
			case ARRAY, OBJECT -> UclJson.toJsonString(value);
		};
	}

	/**
	 * Numeric coercion for arithmetic: numbers as is, numeric strings parsed,
	 * null as 0.
	 *
	 * @throws UclTypeException for any other value
	 */
	public static double toNumber(UclValue value) {
		if (value instanceof UclNumber number) {
			return number.value();
		}
		if (value instanceof UclNull) {
			return 0;
		}
		if (value instanceof UclString string) {
			return parseNumeric(string)
					.orElseThrow(() -> new UclTypeException("Cannot convert '" + string.value() + "' to number"));
		}
		throw new UclTypeException("Cannot convert " + value.typeName() + " '" + toText(value) + "' to number");
	}

	private static Optional<Double> parseNumeric(UclString string) {
		String text = string.value().trim();
		if (Literals.isNumber(text)) {
			return Optional.of(Double.parseDouble(text));
		}
		return Optional.empty();
	}

	private static UclTypeException cannotConvert(UclValue value, ConversionTarget target) {
		return new UclTypeException("Cannot convert " + value.typeName() + " '" + toText(value) + "' to " + target.suffix());
	}
}
