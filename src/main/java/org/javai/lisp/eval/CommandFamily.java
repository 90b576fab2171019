package org.javai.lisp.eval;

/**
 * The three groups of recognized leading symbols.
 */
public enum CommandFamily {
	/** Forms that decide for themselves which arguments get evaluated. */
	SPECIAL_FORM,
	/** Binary integer operators; both operands are evaluated. */
	ARITHMETIC,
	/** List primitives; every operand is evaluated. */
	LIST
}
