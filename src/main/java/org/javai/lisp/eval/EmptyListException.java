package org.javai.lisp.eval;

/**
 * Thrown when {@code head} or {@code tail} is applied to the empty list.
 */
public class EmptyListException extends LispException {

	public EmptyListException(String message) {
		super(message);
	}
}
