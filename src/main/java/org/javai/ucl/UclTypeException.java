package org.javai.ucl;

/**
 * Exception thrown when a value cannot take part in an operation: an
 * impossible conversion, a non-numeric arithmetic operand, or division by zero.
 */
public class UclTypeException extends UclException {

	public UclTypeException(String message) {
		super(message);
	}
}
