package org.javai.ucl.internal.eval;

import java.util.Locale;
import java.util.Optional;

/**
 * The type names accepted as a conversion suffix, as in {@code port.int}.
 */
public enum ConversionTarget {
	INT,
	FLOAT,
	STRING,
	BOOL;

	/**
	 * Matches a suffix case-insensitively.
	 */
	public static Optional<ConversionTarget> fromSuffix(String suffix) {
		for (ConversionTarget target : values()) {
			if (target.suffix().equalsIgnoreCase(suffix)) {
				return Optional.of(target);
			}
		}
		return Optional.empty();
	}

	public String suffix() {
		return name().toLowerCase(Locale.ROOT);
	}
}
