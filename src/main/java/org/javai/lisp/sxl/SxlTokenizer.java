package org.javai.lisp.sxl;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Tokenizer for Lisp source text.
 * Converts input string into a stream of tokens. Comments start with {@code ;}
 * and run to the end of the line.
 */
public class SxlTokenizer {

	private static final Pattern INTEGER = Pattern.compile("[+-]?\\d+");

	private final String input;
	private int pos = 0;

	public SxlTokenizer(String input) {
		this.input = input != null ? input : "";
	}

	/**
	 * Tokenizes the entire input string.
	 *
	 * @return list of tokens (includes EOF token at end)
	 */
	public List<SxlToken> tokenize() {
		List<SxlToken> tokens = new ArrayList<>();

		while (!isAtEnd()) {
			skipWhitespaceAndComments();
			if (isAtEnd()) break;

			tokens.add(nextToken());
		}

		tokens.add(new SxlToken(SxlToken.TokenType.EOF, "", pos));
		return tokens;
	}

	private SxlToken nextToken() {
		int start = pos;
		char c = peek();

		return switch (c) {
			case '(' -> {
				advance();
				yield new SxlToken(SxlToken.TokenType.LPAREN, "(", start);
			}
			case ')' -> {
				advance();
				yield new SxlToken(SxlToken.TokenType.RPAREN, ")", start);
			}
			case '\'' -> {
				advance();
				yield new SxlToken(SxlToken.TokenType.QUOTE, "'", start);
			}
			default -> scanAtom();
		};
	}

	private SxlToken scanAtom() {
		int start = pos;

		while (!isAtEnd() && !isDelimiter(peek())) {
			advance();
		}

		String value = input.substring(start, pos);
		if ("#t".equals(value) || "#f".equals(value)) {
			return new SxlToken(SxlToken.TokenType.BOOLEAN, value, start);
		}
		if (INTEGER.matcher(value).matches()) {
			return new SxlToken(SxlToken.TokenType.INTEGER, value, start);
		}
		return new SxlToken(SxlToken.TokenType.SYMBOL, value, start);
	}

	private void skipWhitespaceAndComments() {
		while (!isAtEnd()) {
			char c = peek();
			if (isWhitespace(c)) {
				advance();
			} else if (c == ';') {
				while (!isAtEnd() && peek() != '\n') {
					advance();
				}
			} else {
				return;
			}
		}
	}

	private char peek() {
		return isAtEnd() ? '\0' : input.charAt(pos);
	}

	private char advance() {
		return input.charAt(pos++);
	}

	private boolean isAtEnd() {
		return pos >= input.length();
	}

	private boolean isWhitespace(char c) {
		return c == ' ' || c == '\t' || c == '\n' || c == '\r' || c == '\f';
	}

	private boolean isDelimiter(char c) {
		return isWhitespace(c) || c == '(' || c == ')' || c == '\'' || c == ';';
	}
}
