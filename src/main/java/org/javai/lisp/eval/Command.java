package org.javai.lisp.eval;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The closed set of leading symbols that trigger command dispatch instead of function
 * application, with the exact number of arguments each one takes.
 */
public enum Command {

	QUOTE("quote", CommandFamily.SPECIAL_FORM, 1),
	ATOM("atom", CommandFamily.SPECIAL_FORM, 1),
	EQ("eq", CommandFamily.SPECIAL_FORM, 2),
	IF("if", CommandFamily.SPECIAL_FORM, 3),
	DEFINE("define", CommandFamily.SPECIAL_FORM, 2),
	LAMBDA("lambda", CommandFamily.SPECIAL_FORM, 2),
	PRINT("print", CommandFamily.SPECIAL_FORM, 1),

	ADD("+", CommandFamily.ARITHMETIC, 2),
	SUBTRACT("-", CommandFamily.ARITHMETIC, 2),
	MULTIPLY("*", CommandFamily.ARITHMETIC, 2),
	DIVIDE("/", CommandFamily.ARITHMETIC, 2),
	MOD("mod", CommandFamily.ARITHMETIC, 2),
	GREATER_THAN(">", CommandFamily.ARITHMETIC, 2),
	LESS_THAN("<", CommandFamily.ARITHMETIC, 2),

	CONS("cons", CommandFamily.LIST, 2),
	HEAD("head", CommandFamily.LIST, 1),
	TAIL("tail", CommandFamily.LIST, 1),
	EMPTY("empty", CommandFamily.LIST, 1);

	private static final Map<String, Command> BY_KEYWORD;

	static {
		Map<String, Command> byKeyword = new HashMap<>();
		for (Command command : values()) {
			byKeyword.put(command.keyword, command);
		}
		BY_KEYWORD = Collections.unmodifiableMap(byKeyword);
	}

	private final String keyword;
	private final CommandFamily family;
	private final int arity;

	Command(String keyword, CommandFamily family, int arity) {
		this.keyword = keyword;
		this.family = family;
		this.arity = arity;
	}

	public String keyword() {
		return keyword;
	}

	public CommandFamily family() {
		return family;
	}

	public int arity() {
		return arity;
	}

	/**
	 * Finds the command for a leading symbol, if it is one.
	 */
	public static Optional<Command> fromKeyword(String symbol) {
		return Optional.ofNullable(BY_KEYWORD.get(symbol));
	}

	public static boolean isKeyword(String symbol) {
		return BY_KEYWORD.containsKey(symbol);
	}

	/**
	 * @throws ArityException if {@code args} does not hold exactly {@link #arity()} elements
	 */
	void requireArity(List<?> args) {
		if (args.size() != arity) {
			throw new ArityException(
					"%s expects exactly %d argument%s, got %d".formatted(
							keyword, arity, arity == 1 ? "" : "s", args.size()),
					arity, args.size());
		}
	}
}
