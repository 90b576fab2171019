package org.javai.lisp.eval;

/**
 * Thrown when the evaluator is handed a value that matches no known AST shape.
 * A well-formed parser never produces one.
 */
public class InvalidAstException extends LispException {

	public InvalidAstException(String message) {
		super(message);
	}
}
