package org.javai.lisp.sxl;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import org.javai.lisp.eval.Environment;

/**
 * A value in the s-expression AST.
 *
 * A node is exactly one of:
 * - an integer, boolean or symbol (the atoms)
 * - a list of nodes, possibly empty
 * - a closure produced by evaluating a {@code lambda} form
 *
 * All variants are immutable. Equality is structural, except that a closure's
 * captured environment compares by identity.
 */
public sealed interface SxlNode {

	record IntNode(long value) implements SxlNode {

		@Override
		public <R> R accept(SxlNodeVisitor<R> visitor) {
			return visitor.visitInteger(value);
		}

		@Override
		public String toString() {
			return Long.toString(value);
		}
	}

	record BoolNode(boolean value) implements SxlNode {

		public static final BoolNode TRUE = new BoolNode(true);
		public static final BoolNode FALSE = new BoolNode(false);

		public static BoolNode of(boolean value) {
			return value ? TRUE : FALSE;
		}

		@Override
		public <R> R accept(SxlNodeVisitor<R> visitor) {
			return visitor.visitBoolean(value);
		}

		@Override
		public String toString() {
			return value ? "#t" : "#f";
		}
	}

	record SymbolNode(String name) implements SxlNode {
		public SymbolNode {
			Objects.requireNonNull(name, "name must not be null");
			if (name.isEmpty()) {
				throw new IllegalArgumentException("Symbol name cannot be empty");
			}
		}

		@Override
		public <R> R accept(SxlNodeVisitor<R> visitor) {
			return visitor.visitSymbol(name);
		}

		@Override
		public String toString() {
			return name;
		}
	}

	record ListNode(List<SxlNode> elements) implements SxlNode {

		public static final ListNode EMPTY = new ListNode(List.of());

		public ListNode {
			// List.copyOf rejects nulls, and the define sentinel is null
			elements = elements != null
					? Collections.unmodifiableList(new ArrayList<>(elements))
					: List.of();
		}

		public static ListNode of(SxlNode... elements) {
			return new ListNode(Arrays.asList(elements));
		}

		public int size() {
			return elements.size();
		}

		public boolean isEmpty() {
			return elements.isEmpty();
		}

		public SxlNode head() {
			return elements.get(0);
		}

		/**
		 * Returns a new list holding every element but the first.
		 */
		public ListNode tail() {
			return new ListNode(elements.subList(1, elements.size()));
		}

		/**
		 * Returns a new list with {@code head} placed in front of this list's elements.
		 */
		public ListNode prepend(SxlNode head) {
			ArrayList<SxlNode> copy = new ArrayList<>(elements.size() + 1);
			copy.add(head);
			copy.addAll(elements);
			return new ListNode(copy);
		}

		@Override
		public <R> R accept(SxlNodeVisitor<R> visitor) {
			return visitor.visitList(elements);
		}

		@Override
		public String toString() {
			return SxlPrettyPrinter.print(this);
		}
	}

	/**
	 * A function value: parameter symbols, an unevaluated body and the environment
	 * that was current when the {@code lambda} form was evaluated. The environment
	 * is shared, never copied, so later definitions in it are visible to the body.
	 */
	record Closure(List<SymbolNode> params, SxlNode body, Environment env) implements SxlNode {
		public Closure {
			params = params != null ? List.copyOf(params) : List.of();
			Objects.requireNonNull(body, "body must not be null");
			Objects.requireNonNull(env, "env must not be null");
		}

		public int arity() {
			return params.size();
		}

		@Override
		public <R> R accept(SxlNodeVisitor<R> visitor) {
			return visitor.visitClosure(this);
		}

		// The environment may hold this closure, so it is left out of the text.
		@Override
		public String toString() {
			return "<closure/" + params.size() + ">";
		}
	}

	/**
	 * Accepts a visitor and dispatches to the visitor method for this variant.
	 *
	 * @param <R> the return type of the visitor
	 * @param visitor the visitor to accept
	 * @return the result of the visitor operation
	 */
	<R> R accept(SxlNodeVisitor<R> visitor);

	default boolean isSymbol() {
		return this instanceof SymbolNode;
	}

	default boolean isBoolean() {
		return this instanceof BoolNode;
	}

	default boolean isInteger() {
		return this instanceof IntNode;
	}

	default boolean isList() {
		return this instanceof ListNode;
	}

	default boolean isClosure() {
		return this instanceof Closure;
	}

	/**
	 * Integers, booleans and symbols are atoms. Lists and closures are not.
	 */
	default boolean isAtom() {
		return isSymbol() || isBoolean() || isInteger();
	}

	static IntNode integer(long value) {
		return new IntNode(value);
	}

	static BoolNode bool(boolean value) {
		return BoolNode.of(value);
	}

	static SymbolNode symbol(String name) {
		return new SymbolNode(name);
	}

	static ListNode list(SxlNode... elements) {
		return ListNode.of(elements);
	}
}
