package org.javai.lisp.sxl;

/**
 * Exception thrown when parsing s-expression source text fails.
 */
public class SxlParseException extends RuntimeException {

	public SxlParseException(String message) {
		super(message);
	}

	public SxlParseException(String message, Throwable cause) {
		super(message, cause);
	}
}
