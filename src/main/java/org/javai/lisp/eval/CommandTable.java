package org.javai.lisp.eval;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.javai.lisp.sxl.SxlNode;

/**
 * Fixed mapping from {@link Command} to its handler. Built once per {@link Evaluator}.
 */
class CommandTable {

	private final Map<Command, CommandHandler> handlers = new EnumMap<>(Command.class);

	CommandTable(Evaluator evaluator) {
		SpecialForms forms = new SpecialForms(evaluator);
		handlers.put(Command.QUOTE, forms::quote);
		handlers.put(Command.ATOM, forms::atom);
		handlers.put(Command.EQ, forms::eq);
		handlers.put(Command.IF, forms::ifForm);
		handlers.put(Command.DEFINE, forms::define);
		handlers.put(Command.LAMBDA, forms::lambda);
		handlers.put(Command.PRINT, forms::print);

		ArithmeticOperators arithmetic = new ArithmeticOperators(evaluator);
		for (Command command : Command.values()) {
			if (command.family() == CommandFamily.ARITHMETIC) {
				handlers.put(command, (args, env) -> arithmetic.apply(command, args, env));
			}
		}

		ListOperators lists = new ListOperators(evaluator);
		handlers.put(Command.CONS, lists::cons);
		handlers.put(Command.HEAD, lists::head);
		handlers.put(Command.TAIL, lists::tail);
		handlers.put(Command.EMPTY, lists::empty);

		for (Command command : Command.values()) {
			if (!handlers.containsKey(command)) {
				throw new IllegalStateException("No handler registered for command: " + command.keyword());
			}
		}
	}

	CommandHandler handlerFor(Command command) {
		return handlers.get(command);
	}

	/**
	 * Checks the argument count, then runs the command's handler on the unevaluated arguments.
	 */
	SxlNode dispatch(Command command, List<SxlNode> args, Environment env) {
		command.requireArity(args);
		return handlerFor(command).apply(args, env);
	}
}
