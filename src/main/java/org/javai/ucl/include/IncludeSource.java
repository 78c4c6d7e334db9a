package org.javai.ucl.include;

import java.nio.charset.Charset;
import java.nio.file.Path;
import org.javai.ucl.UclInclusionException;

/**
 * Supplies the text of documents named by {@code include} directives and of
 * top-level documents parsed from a file.
 */
public interface IncludeSource {

	/**
	 * Resolves an include path against the base directory of the top-level
	 * document. Nested includes resolve against the same base directory, not
	 * against the directory of the file that contains them.
	 */
	default Path resolve(Path baseDirectory, String path) {
		return baseDirectory.resolve(path).toAbsolutePath().normalize();
	}

	/**
	 * Reads the full text of a resolved document.
	 *
	 * @throws UclInclusionException if the document does not exist or cannot be read
	 */
	String read(Path resolvedPath);

	static IncludeSource fileSystem(Charset charset) {
		return new FileSystemIncludeSource(charset);
	}
}
