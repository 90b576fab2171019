package org.javai.lisp.eval;

import java.util.List;
import org.javai.lisp.sxl.SxlNode;

/**
 * Binary integer operators. Both operands are evaluated left to right and must be integers.
 * {@code /} truncates toward zero and {@code mod} takes the sign of the dividend.
 */
class ArithmeticOperators {

	private final Evaluator evaluator;

	ArithmeticOperators(Evaluator evaluator) {
		this.evaluator = evaluator;
	}

	SxlNode apply(Command command, List<SxlNode> args, Environment env) {
		long x = requireInteger(command, evaluator.evaluate(args.get(0), env));
		long y = requireInteger(command, evaluator.evaluate(args.get(1), env));

		return switch (command) {
			case ADD -> SxlNode.integer(x + y);
			case SUBTRACT -> SxlNode.integer(x - y);
			case MULTIPLY -> SxlNode.integer(x * y);
			case DIVIDE -> SxlNode.integer(divide(command, x, y));
			case MOD -> SxlNode.integer(remainder(command, x, y));
			case GREATER_THAN -> SxlNode.bool(x > y);
			case LESS_THAN -> SxlNode.bool(x < y);
			default -> throw new IllegalArgumentException("Not an arithmetic command: " + command);
		};
	}

	private long divide(Command command, long x, long y) {
		try {
			return x / y;
		} catch (ArithmeticException e) {
			throw divisionByZero(command, x, e);
		}
	}

	private long remainder(Command command, long x, long y) {
		try {
			return x % y;
		} catch (ArithmeticException e) {
			throw divisionByZero(command, x, e);
		}
	}

	private DivisionByZeroException divisionByZero(Command command, long x, ArithmeticException cause) {
		return new DivisionByZeroException(
				"Division by zero in (" + command.keyword() + " " + x + " 0)", cause);
	}

	private long requireInteger(Command command, SxlNode operand) {
		if (operand instanceof SxlNode.IntNode integer) {
			return integer.value();
		}
		throw new LispTypeException(
				command.keyword() + " expects integer operands, got " + evaluator.unparse(operand));
	}
}
