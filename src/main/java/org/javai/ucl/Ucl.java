package org.javai.ucl;

import java.nio.file.Path;
import org.javai.ucl.value.UclObject;

/**
 * Static shortcuts backed by a default {@link UclParser}.
 */
public final class Ucl {

	private static final UclParser DEFAULT_PARSER = UclParser.create();

	private Ucl() {
	}

	public static UclObject parse(String text) {
		return DEFAULT_PARSER.parse(text);
	}

	public static UclObject parseFile(Path path) {
		return DEFAULT_PARSER.parseFile(path);
	}

	public static String print(UclObject document) {
		return UclPrettyPrinter.print(document);
	}
}
