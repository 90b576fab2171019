package org.javai.lisp.eval;

/**
 * Base class for semantic errors raised while evaluating an AST.
 *
 * <p>Evaluation never recovers from these. The first one raised aborts the whole
 * {@link Evaluator#evaluate} call chain and reaches the caller unchanged.</p>
 */
public abstract class LispException extends RuntimeException {

	protected LispException(String message) {
		super(message);
	}

	protected LispException(String message, Throwable cause) {
		super(message, cause);
	}
}
