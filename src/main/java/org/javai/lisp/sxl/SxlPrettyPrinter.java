package org.javai.lisp.sxl;

import java.util.List;

/**
 * Visitor that prints an SxlNode back to source form.
 *
 * Booleans print as {@code #t} / {@code #f}, closures as {@code <closure/N>} where N is the
 * parameter count, and the value-less result of {@code define} as {@code nil}.
 */
public class SxlPrettyPrinter implements SxlNodeVisitor<Void> {

	static final String NO_VALUE = "nil";

	private final StringBuilder output = new StringBuilder();
	private final boolean quoteShorthand;

	public SxlPrettyPrinter() {
		this(true);
	}

	/**
	 * @param quoteShorthand whether {@code (quote x)} is printed as {@code 'x}
	 */
	public SxlPrettyPrinter(boolean quoteShorthand) {
		this.quoteShorthand = quoteShorthand;
	}

	@Override
	public Void visitInteger(long value) {
		output.append(value);
		return null;
	}

	@Override
	public Void visitBoolean(boolean value) {
		output.append(value ? "#t" : "#f");
		return null;
	}

	@Override
	public Void visitSymbol(String name) {
		output.append(name);
		return null;
	}

	@Override
	public Void visitList(List<SxlNode> elements) {
		if (quoteShorthand && isQuoteForm(elements)) {
			output.append('\'');
			append(elements.get(1));
			return null;
		}

		output.append('(');
		for (int i = 0; i < elements.size(); i++) {
			if (i > 0) {
				output.append(' ');
			}
			append(elements.get(i));
		}
		output.append(')');
		return null;
	}

	@Override
	public Void visitClosure(SxlNode.Closure closure) {
		output.append("<closure/").append(closure.arity()).append('>');
		return null;
	}

	private void append(SxlNode node) {
		if (node == null) {
			output.append(NO_VALUE);
		} else {
			node.accept(this);
		}
	}

	private boolean isQuoteForm(List<SxlNode> elements) {
		return elements.size() == 2
				&& elements.get(0) instanceof SxlNode.SymbolNode symbol
				&& "quote".equals(symbol.name());
	}

	/**
	 * Returns the printed output as a string.
	 */
	public String toString() {
		return output.toString();
	}

	/**
	 * Static convenience method to print a node, using the quote shorthand.
	 * A {@code null} node prints as {@code nil}.
	 */
	public static String print(SxlNode node) {
		return print(node, true);
	}

	public static String print(SxlNode node, boolean quoteShorthand) {
		SxlPrettyPrinter printer = new SxlPrettyPrinter(quoteShorthand);
		printer.append(node);
		return printer.toString();
	}
}
