package org.javai.ucl;

/**
 * Exception thrown when a reference cannot be resolved against the document.
 */
public class UclReferenceException extends UclException {

	public UclReferenceException(String message) {
		super(message);
	}
}
