package org.javai.lisp.sxl;

import static org.assertj.core.api.Assertions.assertThat;
import static org.javai.lisp.sxl.SxlNode.bool;
import static org.javai.lisp.sxl.SxlNode.integer;
import static org.javai.lisp.sxl.SxlNode.list;
import static org.javai.lisp.sxl.SxlNode.symbol;

import java.util.Arrays;
import java.util.List;
import org.javai.lisp.eval.Environment;
import org.junit.jupiter.api.Test;

class SxlPrettyPrinterTest {

	@Test
	void printsAtoms() {
		assertThat(SxlPrettyPrinter.print(integer(-12))).isEqualTo("-12");
		assertThat(SxlPrettyPrinter.print(bool(true))).isEqualTo("#t");
		assertThat(SxlPrettyPrinter.print(bool(false))).isEqualTo("#f");
		assertThat(SxlPrettyPrinter.print(symbol("fact"))).isEqualTo("fact");
	}

	@Test
	void printsNestedLists() {
		SxlNode node = list(symbol("if"), list(symbol("eq"), symbol("n"), integer(0)), integer(1), list());

		assertThat(SxlPrettyPrinter.print(node)).isEqualTo("(if (eq n 0) 1 ())");
	}

	@Test
	void printsQuoteFormWithShorthandUnlessDisabled() {
		SxlNode quoted = list(symbol("quote"), list(integer(1), integer(2)));

		assertThat(SxlPrettyPrinter.print(quoted)).isEqualTo("'(1 2)");
		assertThat(SxlPrettyPrinter.print(quoted, false)).isEqualTo("(quote (1 2))");
	}

	@Test
	void quoteWithWrongArgumentCountIsPrintedAsList() {
		assertThat(SxlPrettyPrinter.print(list(symbol("quote"), integer(1), integer(2)))).isEqualTo("(quote 1 2)");
	}

	@Test
	void printsClosureByArity() {
		SxlNode.Closure closure = new SxlNode.Closure(List.of(symbol("x"), symbol("y")), symbol("x"), new Environment());

		assertThat(SxlPrettyPrinter.print(closure)).isEqualTo("<closure/2>");
	}

	@Test
	void printsMissingValueAsNil() {
		assertThat(SxlPrettyPrinter.print(null)).isEqualTo("nil");
		assertThat(SxlPrettyPrinter.print(new SxlNode.ListNode(Arrays.asList(integer(1), null))))
				.isEqualTo("(1 nil)");
	}

	@Test
	void printedSourceParsesBackToSameAst() {
		String source = "(define xs '(1 #t (a b) ()))";

		assertThat(SxlPrettyPrinter.print(SxlParser.parseExpression(source))).isEqualTo(source);
	}
}
