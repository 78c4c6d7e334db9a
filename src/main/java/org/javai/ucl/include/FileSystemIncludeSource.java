package org.javai.ucl.include;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import org.javai.ucl.UclInclusionException;

/**
 * Reads documents from the local file system. A leading byte order mark is
 * dropped.
 */
public final class FileSystemIncludeSource implements IncludeSource {

	private static final char BYTE_ORDER_MARK = '\uFEFF';

	private final Charset charset;

	public FileSystemIncludeSource(Charset charset) {
		this.charset = Objects.requireNonNull(charset, "charset must not be null");
	}

	@Override
	public String read(Path resolvedPath) {
		if (!Files.isRegularFile(resolvedPath)) {
			throw new UclInclusionException("File not found: " + resolvedPath);
		}
		try {
			String text = Files.readString(resolvedPath, charset);
			return !text.isEmpty() && text.charAt(0) == BYTE_ORDER_MARK ? text.substring(1) : text;
		} catch (IOException e) {
			throw new UclInclusionException("Failed to read file: " + resolvedPath, e);
		}
	}
}
