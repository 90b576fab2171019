package org.javai.lisp.eval;

import java.util.List;
import org.javai.lisp.sxl.SxlNode;

/**
 * Implementation of one command. Receives the unevaluated argument expressions.
 */
@FunctionalInterface
interface CommandHandler {

	SxlNode apply(List<SxlNode> args, Environment env);
}
