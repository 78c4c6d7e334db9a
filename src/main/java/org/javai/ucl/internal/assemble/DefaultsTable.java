package org.javai.ucl.internal.assemble;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.javai.ucl.value.UclObject;
import org.javai.ucl.value.UclValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fallback values declared in the trailing {@code [Defaults]} block, keyed by
 * the dotted path exactly as written.
 * <p>
 * Defaults are not merged while the document is assembled. They are applied
 * once afterwards, and only where the document has no value or a null value.
 */
final class DefaultsTable {

	private static final Logger logger = LoggerFactory.getLogger(DefaultsTable.class);

	private final Map<String, UclValue> defaults = new LinkedHashMap<>();

	void put(String dottedPath, UclValue value) {
		defaults.put(dottedPath, value);
	}

	int size() {
		return defaults.size();
	}

	/**
	 * Writes each default whose path is absent from {@code document} or holds
	 * null, creating intermediate objects as needed. Existing non-null values
	 * are left untouched.
	 */
	void applyTo(UclObject document) {
		defaults.forEach((dottedPath, value) -> {
			List<String> path = List.of(dottedPath.split("\\.", -1));
			Optional<UclValue> existing = document.at(path);
			if (existing.isPresent() && !existing.get().isNull()) {
				logger.debug("Default for {} skipped: value already set", dottedPath);
				return;
			}
			logger.debug("Default for {} applied", dottedPath);
			document.putPath(path, value);
		});
	}
}
