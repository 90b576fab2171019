package org.javai.lisp.eval;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.javai.lisp.sxl.SxlNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Handlers for {@code quote}, {@code atom}, {@code eq}, {@code if}, {@code define},
 * {@code lambda} and {@code print}. Arity has already been checked by the
 * {@link CommandTable}.
 */
class SpecialForms {

	private static final Logger logger = LoggerFactory.getLogger(SpecialForms.class);

	private final Evaluator evaluator;

	SpecialForms(Evaluator evaluator) {
		this.evaluator = evaluator;
	}

	SxlNode quote(List<SxlNode> args, Environment env) {
		return args.get(0);
	}

	SxlNode atom(List<SxlNode> args, Environment env) {
		SxlNode value = evaluator.evaluate(args.get(0), env);
		return SxlNode.bool(value != null && value.isAtom());
	}

	SxlNode eq(List<SxlNode> args, Environment env) {
		SxlNode left = evaluator.evaluate(args.get(0), env);
		SxlNode right = evaluator.evaluate(args.get(1), env);
		return SxlNode.bool(Objects.equals(left, right));
	}

	SxlNode ifForm(List<SxlNode> args, Environment env) {
		SxlNode predicate = evaluator.evaluate(args.get(0), env);
		return Evaluator.isTruthy(predicate)
				? evaluator.evaluate(args.get(1), env)
				: evaluator.evaluate(args.get(2), env);
	}

	/**
	 * Binds the symbol in the current environment. Returns {@code null}: define has no value.
	 */
	SxlNode define(List<SxlNode> args, Environment env) {
		if (!(args.get(0) instanceof SxlNode.SymbolNode name)) {
			throw new LispTypeException(
					"define expects a symbol as its first argument, got " + evaluator.unparse(args.get(0)));
		}
		SxlNode value = evaluator.evaluate(args.get(1), env);
		env.set(name, value);
		logger.debug("Defined {} = {}", name.name(), evaluator.unparse(value));
		return null;
	}

	/**
	 * Builds a closure over {@code env}. A lambda with an empty parameter list is not deferred:
	 * its body is evaluated right away and that result is returned instead of a closure.
	 */
	SxlNode lambda(List<SxlNode> args, Environment env) {
		if (!(args.get(0) instanceof SxlNode.ListNode paramList)) {
			throw new LispTypeException(
					"lambda expects a list of parameters, got " + evaluator.unparse(args.get(0)));
		}
		SxlNode body = args.get(1);

		if (paramList.isEmpty()) {
			return evaluator.evaluate(body, env);
		}

		List<SxlNode.SymbolNode> params = new ArrayList<>(paramList.size());
		for (SxlNode param : paramList.elements()) {
			if (!(param instanceof SxlNode.SymbolNode symbol)) {
				throw new LispTypeException(
						"lambda parameters must be symbols, got " + evaluator.unparse(param));
			}
			params.add(symbol);
		}
		return new SxlNode.Closure(params, body, env);
	}

	SxlNode print(List<SxlNode> args, Environment env) {
		SxlNode value = evaluator.evaluate(args.get(0), env);
		String text = evaluator.unparse(value);
		logger.debug("print {}", text);
		evaluator.printChannel().emit(text);
		return value;
	}
}
