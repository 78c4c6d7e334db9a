package org.javai.ucl.internal.assemble;

import java.util.Optional;
import org.javai.ucl.internal.lex.QuoteTracker;

/**
 * A {@code key = value} line split on its first {@code =} outside quotes.
 * Both sides are trimmed.
 */
record KeyValueLine(String key, String value) {

	static Optional<KeyValueLine> split(String line) {
		int equals = QuoteTracker.indexOfUnquoted(line, '=');
		if (equals < 0) {
			return Optional.empty();
		}
		return Optional.of(new KeyValueLine(line.substring(0, equals).trim(), line.substring(equals + 1).trim()));
	}

	boolean startsStructuredValue() {
		return value.startsWith("{") || value.startsWith("[");
	}
}
