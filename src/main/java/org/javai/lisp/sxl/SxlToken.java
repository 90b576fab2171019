package org.javai.lisp.sxl;

/**
 * Represents a token in Lisp source text.
 *
 * @param type the token type
 * @param value the token value (text content)
 * @param position the character position in the input string
 */
public record SxlToken(TokenType type, String value, int position) {

	public enum TokenType {
		SYMBOL,        // names, operators, keywords
		INTEGER,       // optionally signed decimal digits
		BOOLEAN,       // #t or #f
		LPAREN,        // (
		RPAREN,        // )
		QUOTE,         // ' shorthand for (quote x)
		EOF            // end of input
	}

	@Override
	public String toString() {
		return switch (type) {
			case SYMBOL, INTEGER, BOOLEAN -> type + "(" + value + ")";
			default -> type.toString();
		};
	}

	public boolean isType(TokenType expectedType) {
		return this.type == expectedType;
	}
}
