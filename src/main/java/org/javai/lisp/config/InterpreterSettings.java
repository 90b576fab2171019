package org.javai.lisp.config;

/**
 * Evaluator settings.
 *
 * @param traceEvaluation log every evaluation step at TRACE level
 * @param quoteShorthand print {@code (quote x)} as {@code 'x} in output and diagnostics
 */
public record InterpreterSettings(boolean traceEvaluation, boolean quoteShorthand) {

	public static final boolean DEFAULT_TRACE_EVALUATION = false;
	public static final boolean DEFAULT_QUOTE_SHORTHAND = true;

	public static InterpreterSettings defaults() {
		return new InterpreterSettings(DEFAULT_TRACE_EVALUATION, DEFAULT_QUOTE_SHORTHAND);
	}

	public InterpreterSettings withTraceEvaluation(boolean traceEvaluation) {
		return new InterpreterSettings(traceEvaluation, quoteShorthand);
	}

	public InterpreterSettings withQuoteShorthand(boolean quoteShorthand) {
		return new InterpreterSettings(traceEvaluation, quoteShorthand);
	}
}
