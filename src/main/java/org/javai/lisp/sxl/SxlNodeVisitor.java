package org.javai.lisp.sxl;

import java.util.List;

/**
 * Visitor interface for traversing SxlNode ASTs.
 *
 * @param <R> the return type of the visitor operations
 */
public interface SxlNodeVisitor<R> {

	R visitInteger(long value);

	R visitBoolean(boolean value);

	R visitSymbol(String name);

	/**
	 * Visits a list node. Elements may include {@code null}, the value produced by
	 * {@code define}, when a list was built at evaluation time.
	 *
	 * @param elements the list elements in order
	 * @return the result of visiting this node
	 */
	R visitList(List<SxlNode> elements);

	R visitClosure(SxlNode.Closure closure);
}
