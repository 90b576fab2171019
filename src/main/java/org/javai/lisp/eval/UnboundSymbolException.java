package org.javai.lisp.eval;

/**
 * Thrown when a symbol is not bound anywhere in an environment chain.
 */
public class UnboundSymbolException extends LispException {

	private final String symbol;

	public UnboundSymbolException(String symbol) {
		super("Unbound symbol: " + symbol);
		this.symbol = symbol;
	}

	public String symbol() {
		return symbol;
	}
}
