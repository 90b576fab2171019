package org.javai.lisp.eval;

/**
 * Thrown when a form, operator or closure receives the wrong number of arguments.
 */
public class ArityException extends LispException {

	private final int expected;
	private final int actual;

	public ArityException(String message, int expected, int actual) {
		super(message);
		this.expected = expected;
		this.actual = actual;
	}

	public int expected() {
		return expected;
	}

	public int actual() {
		return actual;
	}
}
