package org.javai.ucl.env;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Looks up environment variables for {@code $ENV{NAME}} values.
 * <p>
 * An absent variable is a normal outcome and yields an empty result; the
 * parser turns it into a null value.
 */
@FunctionalInterface
public interface EnvironmentSource {

	Optional<String> lookup(String name);

	/**
	 * Reads the process environment at lookup time.
	 */
	static EnvironmentSource system() {
		return name -> Optional.ofNullable(System.getenv(name));
	}

	/**
	 * A fixed environment backed by a copy of {@code variables}.
	 */
	static EnvironmentSource of(Map<String, String> variables) {
		Objects.requireNonNull(variables, "variables must not be null");
		Map<String, String> copy = Map.copyOf(variables);
		return name -> Optional.ofNullable(copy.get(name));
	}
}
