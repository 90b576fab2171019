package org.javai.lisp.eval;

/**
 * Thrown when an operand has the wrong shape, e.g. a non-integer given to {@code +}
 * or a non-list given to {@code head}.
 */
public class LispTypeException extends LispException {

	public LispTypeException(String message) {
		super(message);
	}
}
