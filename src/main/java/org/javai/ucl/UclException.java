package org.javai.ucl;

/**
 * Base exception for every failure raised while parsing a UCL document.
 * <p>
 * Callers can catch this type to handle all parse failures, or one of the
 * subclasses to react to a single kind of failure:
 * <ul>
 *   <li>{@link UclSyntaxException} - malformed document text</li>
 *   <li>{@link UclReferenceException} - a reference that cannot be resolved</li>
 *   <li>{@link UclTypeException} - a value of the wrong type for an operation</li>
 *   <li>{@link UclInclusionException} - an include target that cannot be read</li>
 * </ul>
 */
public class UclException extends RuntimeException {

	public UclException(String message) {
		super(message);
	}

	public UclException(String message, Throwable cause) {
		super(message, cause);
	}
}
