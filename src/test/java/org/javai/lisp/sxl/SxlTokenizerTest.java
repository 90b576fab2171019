package org.javai.lisp.sxl;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.Test;

class SxlTokenizerTest {

	@Test
	void tokenizeEmptyString() {
		List<SxlToken> tokens = new SxlTokenizer("").tokenize();

		assertThat(tokens).hasSize(1);
		assertThat(tokens.get(0).type()).isEqualTo(SxlToken.TokenType.EOF);
	}

	@Test
	void tokenizeNullInput() {
		List<SxlToken> tokens = new SxlTokenizer(null).tokenize();

		assertThat(tokens).extracting(SxlToken::type).containsExactly(SxlToken.TokenType.EOF);
	}

	@Test
	void tokenizeWhitespaceOnly() {
		List<SxlToken> tokens = new SxlTokenizer("   \n\t  ").tokenize();

		assertThat(tokens).extracting(SxlToken::type).containsExactly(SxlToken.TokenType.EOF);
	}

	@Test
	void tokenizeParenthesesAndQuote() {
		List<SxlToken> tokens = new SxlTokenizer("'()").tokenize();

		assertThat(tokens).extracting(SxlToken::type).containsExactly(
				SxlToken.TokenType.QUOTE,
				SxlToken.TokenType.LPAREN,
				SxlToken.TokenType.RPAREN,
				SxlToken.TokenType.EOF);
	}

	@Test
	void classifiesAtoms() {
		List<SxlToken> tokens = new SxlTokenizer("foo 42 -7 +3 #t #f - mod").tokenize();

		assertThat(tokens).extracting(SxlToken::type).containsExactly(
				SxlToken.TokenType.SYMBOL,
				SxlToken.TokenType.INTEGER,
				SxlToken.TokenType.INTEGER,
				SxlToken.TokenType.INTEGER,
				SxlToken.TokenType.BOOLEAN,
				SxlToken.TokenType.BOOLEAN,
				SxlToken.TokenType.SYMBOL,
				SxlToken.TokenType.SYMBOL,
				SxlToken.TokenType.EOF);
		assertThat(tokens.get(2).value()).isEqualTo("-7");
	}

	@Test
	void operatorsAndPunctuatedNamesAreSymbols() {
		List<SxlToken> tokens = new SxlTokenizer("+ * / < > set! list->vector 12abc").tokenize();

		assertThat(tokens.subList(0, tokens.size() - 1))
				.allMatch(token -> token.isType(SxlToken.TokenType.SYMBOL));
		assertThat(tokens.get(7).value()).isEqualTo("12abc");
	}

	@Test
	void atomsEndAtParenthesesWithoutWhitespace() {
		List<SxlToken> tokens = new SxlTokenizer("(+ 1(f x))").tokenize();

		assertThat(tokens).extracting(SxlToken::value)
				.containsExactly("(", "+", "1", "(", "f", "x", ")", ")", "");
	}

	@Test
	void skipsCommentsToEndOfLine() {
		List<SxlToken> tokens = new SxlTokenizer("""
				; leading comment
				(a ; trailing comment (ignored)
				 b)""").tokenize();

		assertThat(tokens).extracting(SxlToken::value).containsExactly("(", "a", "b", ")", "");
	}

	@Test
	void recordsPositions() {
		List<SxlToken> tokens = new SxlTokenizer("  (abc 12)").tokenize();

		assertThat(tokens.get(0).position()).isEqualTo(2);
		assertThat(tokens.get(1).position()).isEqualTo(3);
		assertThat(tokens.get(2).position()).isEqualTo(7);
		assertThat(tokens.get(3).position()).isEqualTo(9);
	}

	@Test
	void tokenToStringShowsValueForAtoms() {
		assertThat(new SxlToken(SxlToken.TokenType.SYMBOL, "x", 0)).hasToString("SYMBOL(x)");
		assertThat(new SxlToken(SxlToken.TokenType.LPAREN, "(", 0)).hasToString("LPAREN");
	}
}
