package org.javai.lisp.eval;

import java.io.PrintStream;
import java.util.Objects;

/**
 * Destination of the {@code print} form. Receives one line of text per invocation.
 */
@FunctionalInterface
public interface PrintChannel {

	void emit(String line);

	static PrintChannel of(PrintStream stream) {
		Objects.requireNonNull(stream, "stream must not be null");
		return stream::println;
	}

	static PrintChannel stdout() {
		return of(System.out);
	}
}
