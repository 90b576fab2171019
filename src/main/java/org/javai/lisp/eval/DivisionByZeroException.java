package org.javai.lisp.eval;

/**
 * Thrown when {@code /} or {@code mod} is given a zero divisor.
 */
public class DivisionByZeroException extends LispException {

	public DivisionByZeroException(String message, ArithmeticException cause) {
		super(message, cause);
	}
}
