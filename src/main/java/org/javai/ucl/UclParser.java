package org.javai.ucl;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import org.javai.ucl.env.EnvironmentSource;
import org.javai.ucl.include.IncludeSource;
import org.javai.ucl.internal.assemble.DocumentAssembler;
import org.javai.ucl.internal.include.IncludeExpander;
import org.javai.ucl.internal.lex.CommentStripper;
import org.javai.ucl.value.UclObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses UCL documents into {@link UclObject} trees.
 * <p>
 * A parser is immutable and may be shared across threads. Every call to
 * {@code parse} builds its own document, so no state leaks between calls.
 *
 * <pre>{@code
 * UclParser parser = UclParser.builder()
 *     .withEnvironment(EnvironmentSource.of(Map.of("PORT", "8080")))
 *     .build();
 * UclObject config = parser.parseFile(Path.of("app.ucl"));
 * }</pre>
 */
public final class UclParser {

	private static final Logger logger = LoggerFactory.getLogger(UclParser.class);

	public static final int DEFAULT_MAX_NESTING_DEPTH = 64;

	private final EnvironmentSource environment;
	private final IncludeSource includeSource;
	private final int maxNestingDepth;

	private UclParser(Builder builder) {
		this.environment = builder.environment;
		this.includeSource = builder.includeSource != null
				? builder.includeSource
				: IncludeSource.fileSystem(builder.charset);
		this.maxNestingDepth = builder.maxNestingDepth;
	}

	/**
	 * Creates a parser with the default configuration: system environment,
	 * UTF-8 file-system includes and a nesting limit of {@value #DEFAULT_MAX_NESTING_DEPTH}.
	 */
	public static UclParser create() {
		return builder().build();
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Parses text whose includes resolve against the working directory.
	 */
	public UclObject parse(String text) {
		return parse(text, Paths.get("").toAbsolutePath());
	}

	/**
	 * Parses text whose includes resolve against {@code baseDirectory}.
	 *
	 * @throws UclException if the document is malformed or cannot be evaluated
	 */
	public UclObject parse(String text, Path baseDirectory) {
		Objects.requireNonNull(text, "text must not be null");
		Objects.requireNonNull(baseDirectory, "baseDirectory must not be null");
		Path base = baseDirectory.toAbsolutePath().normalize();
		List<String> lines = expander(base).expand(splitLines(text));
		return assemble(lines);
	}

	/**
	 * Reads and parses a document file. Includes resolve against the directory
	 * containing the file.
	 *
	 * @throws UclInclusionException if the file does not exist or cannot be read
	 */
	public UclObject parseFile(Path path) {
		Objects.requireNonNull(path, "path must not be null");
		Path resolved = path.toAbsolutePath().normalize();
		Path base = resolved.getParent() != null ? resolved.getParent() : resolved;
		logger.debug("Parsing {}", resolved);
		String text = includeSource.read(resolved);
		List<String> lines = expander(base).expand(splitLines(text), resolved);
		return assemble(lines);
	}

	private IncludeExpander expander(Path base) {
		return new IncludeExpander(includeSource, base, maxNestingDepth);
	}

	private UclObject assemble(List<String> lines) {
		UclObject document = new DocumentAssembler(environment, maxNestingDepth).assemble(lines);
		logger.debug("Parsed document with {} top-level keys", document.size());
		return document;
	}

	private static List<String> splitLines(String text) {
		return Arrays.asList(CommentStripper.strip(text).split("\n", -1));
	}

	public static final class Builder {

		private EnvironmentSource environment = EnvironmentSource.system();
		private IncludeSource includeSource;
		private int maxNestingDepth = DEFAULT_MAX_NESTING_DEPTH;
		private Charset charset = StandardCharsets.UTF_8;

		private Builder() {
		}

		public Builder withEnvironment(EnvironmentSource environment) {
			this.environment = Objects.requireNonNull(environment, "environment must not be null");
			return this;
		}

		/**
		 * Replaces the file-system include source. When set, {@link #withCharset}
		 * has no effect.
		 */
		public Builder withIncludeSource(IncludeSource includeSource) {
			this.includeSource = Objects.requireNonNull(includeSource, "includeSource must not be null");
			return this;
		}

		/**
		 * Limits both include nesting and value nesting.
		 */
		public Builder withMaxNestingDepth(int maxNestingDepth) {
			if (maxNestingDepth <= 0) {
				throw new IllegalArgumentException("maxNestingDepth must be positive, was " + maxNestingDepth);
			}
			this.maxNestingDepth = maxNestingDepth;
			return this;
		}

		public Builder withCharset(Charset charset) {
			this.charset = Objects.requireNonNull(charset, "charset must not be null");
			return this;
		}

		public UclParser build() {
			return new UclParser(this);
		}
	}
}
