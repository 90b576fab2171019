package org.javai.lisp.eval;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.javai.lisp.config.InterpreterSettings;
import org.javai.lisp.config.InterpreterSettingsLoader;
import org.javai.lisp.sxl.SxlNode;
import org.javai.lisp.sxl.SxlPrettyPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Evaluates {@link SxlNode} ASTs against an {@link Environment}.
 *
 * <p>Rules, by shape of the AST:</p>
 * <ul>
 *   <li>symbol: looked up in the environment chain</li>
 *   <li>integer, boolean, closure, empty list: evaluate to themselves</li>
 *   <li>list headed by a command keyword: dispatched to that command</li>
 *   <li>list headed by any other symbol: the symbol must name a closure, which is applied
 *   to the remaining elements</li>
 *   <li>list headed by a closure: the closure is applied to the remaining elements</li>
 *   <li>list headed by anything else: the head is evaluated; a closure result is applied
 *   to the remaining elements, otherwise see {@link #evaluateList}</li>
 * </ul>
 *
 * <p>Evaluation is single-threaded and plainly recursive. There is no tail-call elimination,
 * so deep recursion in a program ends in a {@link StackOverflowError}.</p>
 */
public class Evaluator {

	private static final Logger logger = LoggerFactory.getLogger(Evaluator.class);

	private final CommandTable commands;
	private final PrintChannel printChannel;
	private final InterpreterSettings settings;

	public Evaluator() {
		this(PrintChannel.stdout());
	}

	/**
	 * Creates an evaluator with the settings bundled at
	 * {@value InterpreterSettingsLoader#DEFAULT_RESOURCE}, if any.
	 */
	public Evaluator(PrintChannel printChannel) {
		this(printChannel, new InterpreterSettingsLoader().loadDefault());
	}

	public Evaluator(PrintChannel printChannel, InterpreterSettings settings) {
		this.printChannel = Objects.requireNonNull(printChannel, "printChannel must not be null");
		this.settings = Objects.requireNonNull(settings, "settings must not be null");
		this.commands = new CommandTable(this);
	}

	/**
	 * Evaluates an AST in the given environment.
	 *
	 * @param ast the expression to evaluate
	 * @param env the environment symbols are resolved in and {@code define} writes to
	 * @return the value, or {@code null} when the expression is a {@code define}
	 * @throws LispException on the first semantic error; nothing is caught on the way up
	 */
	public SxlNode evaluate(SxlNode ast, Environment env) {
		if (settings.traceEvaluation() && logger.isTraceEnabled()) {
			logger.trace("evaluate {}", unparse(ast));
		}

		if (ast instanceof SxlNode.SymbolNode symbol) {
			return env.lookup(symbol);
		}
		if (ast instanceof SxlNode.IntNode || ast instanceof SxlNode.BoolNode || ast instanceof SxlNode.Closure) {
			return ast;
		}
		if (ast instanceof SxlNode.ListNode list) {
			return evaluateList(list, env);
		}
		throw new InvalidAstException("Invalid AST: " + unparse(ast));
	}

	/**
	 * Evaluates a list form.
	 *
	 * <p>When the head is neither a symbol nor a closure and does not evaluate to a closure,
	 * its value is discarded and the remaining elements are evaluated as a list of their own.
	 * With no remaining elements the head's value is returned. A program written as a list of
	 * top-level forms runs this way, each form for its effect, yielding the last value.</p>
	 */
	private SxlNode evaluateList(SxlNode.ListNode list, Environment env) {
		if (list.isEmpty()) {
			return list;
		}

		SxlNode first = list.head();
		SxlNode.ListNode rest = list.tail();

		if (first instanceof SxlNode.SymbolNode symbol) {
			Optional<Command> command = Command.fromKeyword(symbol.name());
			if (command.isPresent()) {
				return commands.dispatch(command.get(), rest.elements(), env);
			}
			SxlNode resolved = env.lookup(symbol);
			if (!(resolved instanceof SxlNode.Closure closure)) {
				throw new NotCallableException(
						"Symbol " + symbol.name() + " must evaluate to a function, got " + unparse(resolved));
			}
			return applyClosure(closure, rest.elements(), env);
		}

		if (first instanceof SxlNode.Closure closure) {
			return applyClosure(closure, rest.elements(), env);
		}

		SxlNode head = evaluate(first, env);
		if (head instanceof SxlNode.Closure closure) {
			return applyClosure(closure, rest.elements(), env);
		}
		// TODO: decide whether a non-callable head should raise NotCallableException instead
		return rest.isEmpty() ? head : evaluate(rest, env);
	}

	/**
	 * Applies a closure, call-by-value. The argument expressions are evaluated left to right in
	 * {@code callerEnv}; the body is evaluated in a child of the closure's own environment that
	 * binds each parameter to its argument.
	 *
	 * @throws ArityException if the argument count differs from the parameter count
	 */
	public SxlNode applyClosure(SxlNode.Closure closure, List<SxlNode> argExprs, Environment callerEnv) {
		if (closure.arity() != argExprs.size()) {
			throw new ArityException(
					"%d parameters expected by function, %d are passed".formatted(closure.arity(), argExprs.size()),
					closure.arity(), argExprs.size());
		}

		Map<String, SxlNode> bindings = new LinkedHashMap<>();
		for (int i = 0; i < argExprs.size(); i++) {
			bindings.put(closure.params().get(i).name(), evaluate(argExprs.get(i), callerEnv));
		}
		return evaluate(closure.body(), closure.env().extend(bindings));
	}

	/**
	 * {@code #f}, {@code 0}, the empty list and the value of {@code define} are false;
	 * every other value is true.
	 */
	static boolean isTruthy(SxlNode value) {
		if (value == null) {
			return false;
		}
		if (value instanceof SxlNode.BoolNode bool) {
			return bool.value();
		}
		if (value instanceof SxlNode.IntNode integer) {
			return integer.value() != 0;
		}
		if (value instanceof SxlNode.ListNode list) {
			return !list.isEmpty();
		}
		return true;
	}

	String unparse(SxlNode node) {
		return SxlPrettyPrinter.print(node, settings.quoteShorthand());
	}

	PrintChannel printChannel() {
		return printChannel;
	}

	public InterpreterSettings settings() {
		return settings;
	}
}
