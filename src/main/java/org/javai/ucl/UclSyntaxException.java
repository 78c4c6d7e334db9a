package org.javai.ucl;

/**
 * Exception thrown when document text is malformed: a key-value line without
 * an {@code =}, mismatched parentheses, an invalid embedded JSON object, a
 * {@code [Defaults]} block that is not last, or a malformed include directive.
 */
public class UclSyntaxException extends UclException {

	public UclSyntaxException(String message) {
		super(message);
	}

	public UclSyntaxException(String message, Throwable cause) {
		super(message, cause);
	}
}
