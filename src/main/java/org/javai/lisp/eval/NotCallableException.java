package org.javai.lisp.eval;

/**
 * Thrown when a value that is not a closure is used in function position.
 */
public class NotCallableException extends LispException {

	public NotCallableException(String message) {
		super(message);
	}
}
