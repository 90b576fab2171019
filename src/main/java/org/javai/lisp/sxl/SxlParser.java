package org.javai.lisp.sxl;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive-descent parser turning tokens from {@link SxlTokenizer} into {@link SxlNode} values.
 *
 * Example usage:
 *
 * <pre>
 * // all top-level expressions
 * SxlParser parser = new SxlParser(new SxlTokenizer(source).tokenize());
 * List&lt;SxlNode&gt; nodes = parser.parse();
 *
 * // exactly one expression
 * SxlNode program = SxlParser.parseExpression("(print (+ 1 2))");
 * </pre>
 */
public class SxlParser {

	private final List<SxlToken> tokens;

	/**
	 * Creates a parser over the given tokens.
	 *
	 * @param tokens the tokens to parse, normally ending with an EOF token
	 */
	public SxlParser(List<SxlToken> tokens) {
		this.tokens = tokens != null ? tokens : List.of();
	}

	/**
	 * Tokenizes and parses source text that must contain exactly one expression.
	 *
	 * @param source the source text
	 * @return the single parsed expression
	 * @throws SxlParseException if the text is malformed, empty, or holds more than one expression
	 */
	public static SxlNode parseExpression(String source) {
		ParserState state = new ParserState(new SxlTokenizer(source).tokenize());
		if (state.isAtEnd()) {
			throw new SxlParseException("Expected an expression but the input is empty");
		}
		SxlNode node = parseNode(state);
		if (!state.isAtEnd()) {
			SxlToken extra = state.peek();
			throw new SxlParseException(
				"Expected EOF at position " + extra.position() + ", found " + extra);
		}
		return node;
	}

	/**
	 * Parses the tokens into a list of top-level expressions.
	 *
	 * @return list of parsed nodes (may be empty)
	 * @throws SxlParseException if syntax errors are encountered
	 */
	public List<SxlNode> parse() {
		ParserState state = new ParserState(tokens);
		List<SxlNode> nodes = new ArrayList<>();

		while (!state.isAtEnd()) {
			nodes.add(parseNode(state));
		}

		return nodes;
	}

	private static SxlNode parseNode(ParserState state) {
		SxlToken token = state.peek();

		return switch (token.type()) {
			case LPAREN -> parseList(state);
			case QUOTE -> parseQuoted(state);
			case INTEGER -> {
				state.advance();
				yield SxlNode.integer(parseInteger(token));
			}
			case BOOLEAN -> {
				state.advance();
				yield SxlNode.bool("#t".equals(token.value()));
			}
			case SYMBOL -> {
				state.advance();
				yield SxlNode.symbol(token.value());
			}
			case RPAREN -> throw new SxlParseException(
				"Expected EOF: unexpected ')' at position " + token.position());
			case EOF -> throw new SxlParseException(
				"Incomplete expression: reached end of input at position " + token.position());
		};
	}

	private static SxlNode parseList(ParserState state) {
		int startPos = state.peek().position();
		state.advance(); // consume '('

		List<SxlNode> elements = new ArrayList<>();
		while (!state.check(SxlToken.TokenType.RPAREN)) {
			if (state.isAtEnd()) {
				throw new SxlParseException(
					"Incomplete expression: unmatched '(' at position " + startPos);
			}
			elements.add(parseNode(state));
		}

		state.advance(); // consume ')'
		return new SxlNode.ListNode(elements);
	}

	private static SxlNode parseQuoted(ParserState state) {
		int quotePos = state.peek().position();
		state.advance(); // consume '

		if (state.isAtEnd() || state.check(SxlToken.TokenType.RPAREN)) {
			throw new SxlParseException("Expected an expression after quote at position " + quotePos);
		}
		return SxlNode.list(SxlNode.symbol("quote"), parseNode(state));
	}

	private static long parseInteger(SxlToken token) {
		try {
			return Long.parseLong(token.value());
		} catch (NumberFormatException e) {
			throw new SxlParseException(
				"Integer literal out of range at position " + token.position() + ": " + token.value(), e);
		}
	}

	/**
	 * Cursor over the token list.
	 */
	static class ParserState {
		private final List<SxlToken> tokens;
		private int current = 0;

		ParserState(List<SxlToken> tokens) {
			this.tokens = tokens;
		}

		SxlToken peek() {
			if (current >= tokens.size()) {
				int end = tokens.isEmpty() ? 0 : tokens.get(tokens.size() - 1).position();
				return new SxlToken(SxlToken.TokenType.EOF, "", end);
			}
			return tokens.get(current);
		}

		SxlToken advance() {
			SxlToken token = peek();
			if (!isAtEnd()) {
				current++;
			}
			return token;
		}

		boolean check(SxlToken.TokenType type) {
			if (isAtEnd()) return false;
			return peek().type() == type;
		}

		boolean isAtEnd() {
			return current >= tokens.size() || peek().type() == SxlToken.TokenType.EOF;
		}
	}
}
