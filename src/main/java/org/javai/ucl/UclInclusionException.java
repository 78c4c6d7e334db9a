package org.javai.ucl;

/**
 * Exception thrown when a document or one of its includes cannot be read.
 */
public class UclInclusionException extends UclException {

	public UclInclusionException(String message) {
		super(message);
	}

	public UclInclusionException(String message, Throwable cause) {
		super(message, cause);
	}
}
