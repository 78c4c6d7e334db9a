package org.javai.ucl.internal.include;

import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.javai.ucl.UclInclusionException;
import org.javai.ucl.UclSyntaxException;
import org.javai.ucl.include.IncludeSource;
import org.javai.ucl.internal.lex.CommentStripper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Splices included documents into a line stream.
 * <p>
 * Every include path, however deeply nested, resolves against the base
 * directory of the top-level document. An included document is comment-stripped
 * and expanded recursively before its lines replace the directive.
 */
public final class IncludeExpander {

	private static final Logger logger = LoggerFactory.getLogger(IncludeExpander.class);

	private static final Pattern DIRECTIVE_START = Pattern.compile("^include\\s.*", Pattern.DOTALL);
	private static final Pattern DIRECTIVE = Pattern.compile("^include\\s+([\"'])([^\"']+)\\1$");

	private final IncludeSource source;
	private final Path baseDirectory;
	private final int maxDepth;

	public IncludeExpander(IncludeSource source, Path baseDirectory, int maxDepth) {
		this.source = Objects.requireNonNull(source, "source must not be null");
		this.baseDirectory = Objects.requireNonNull(baseDirectory, "baseDirectory must not be null");
		this.maxDepth = maxDepth;
	}

	/**
	 * Expands every include directive in {@code lines}.
	 *
	 * @throws UclSyntaxException if a directive is malformed
	 * @throws UclInclusionException if an included document is missing or includes itself
	 */
	public List<String> expand(List<String> lines) {
		return expand(lines, new ArrayDeque<>());
	}

	/**
	 * Expands {@code lines} read from {@code origin}, so that an include of the
	 * origin itself is reported as a cycle.
	 */
	public List<String> expand(List<String> lines, Path origin) {
		Deque<Path> chain = new ArrayDeque<>();
		chain.push(origin);
		return expand(lines, chain);
	}

	private List<String> expand(List<String> lines, Deque<Path> chain) {
		List<String> expanded = new ArrayList<>(lines.size());
		for (String line : lines) {
			String trimmed = line.trim();
			if (!DIRECTIVE_START.matcher(trimmed).matches()) {
				expanded.add(line);
				continue;
			}
			Matcher matcher = DIRECTIVE.matcher(trimmed);
			if (!matcher.matches()) {
				throw new UclSyntaxException("Invalid include syntax: " + trimmed);
			}
			expanded.addAll(include(matcher.group(2), chain));
		}
		return expanded;
	}

	private List<String> include(String path, Deque<Path> chain) {
		Path resolved = source.resolve(baseDirectory, path);
		if (chain.contains(resolved)) {
			String cycle = chain.stream().map(Path::toString).collect(Collectors.joining(" -> "));
			throw new UclInclusionException("Include cycle detected: " + cycle + " -> " + resolved);
		}
		if (chain.size() >= maxDepth) {
			throw new UclSyntaxException("Include nesting exceeds maximum depth of " + maxDepth + " at: " + path);
		}
		String content;
		try {
			content = source.read(resolved);
		} catch (UclInclusionException e) {
			throw new UclInclusionException("Cannot include '" + path + "': " + e.getMessage(), e);
		}
		logger.debug("Including '{}' from {}", path, resolved);

		chain.push(resolved);
		try {
			List<String> includedLines = Arrays.asList(CommentStripper.strip(content).split("\n", -1));
			return expand(includedLines, chain);
		} finally {
			chain.pop();
		}
	}
}
