package org.javai.lisp.eval;

import java.util.List;
import org.javai.lisp.sxl.SxlNode;

/**
 * {@code cons}, {@code head}, {@code tail} and {@code empty}. Every operand is evaluated.
 */
class ListOperators {

	private final Evaluator evaluator;

	ListOperators(Evaluator evaluator) {
		this.evaluator = evaluator;
	}

	SxlNode cons(List<SxlNode> args, Environment env) {
		SxlNode head = evaluator.evaluate(args.get(0), env);
		SxlNode rest = evaluator.evaluate(args.get(1), env);
		return requireList(Command.CONS, rest, "as its second argument").prepend(head);
	}

	SxlNode head(List<SxlNode> args, Environment env) {
		return requireNonEmpty(Command.HEAD, evaluator.evaluate(args.get(0), env)).head();
	}

	SxlNode tail(List<SxlNode> args, Environment env) {
		return requireNonEmpty(Command.TAIL, evaluator.evaluate(args.get(0), env)).tail();
	}

	SxlNode empty(List<SxlNode> args, Environment env) {
		SxlNode value = evaluator.evaluate(args.get(0), env);
		return SxlNode.bool(requireList(Command.EMPTY, value, "as argument").isEmpty());
	}

	private SxlNode.ListNode requireNonEmpty(Command command, SxlNode value) {
		SxlNode.ListNode list = requireList(command, value, "as argument");
		if (list.isEmpty()) {
			throw new EmptyListException(command.keyword() + " expects a non-empty list");
		}
		return list;
	}

	private SxlNode.ListNode requireList(Command command, SxlNode value, String position) {
		if (value instanceof SxlNode.ListNode list) {
			return list;
		}
		throw new LispTypeException(
				command.keyword() + " expects a list " + position + ", got " + evaluator.unparse(value));
	}
}
