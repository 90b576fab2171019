package org.javai.lisp.eval;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.javai.lisp.sxl.SxlNode;

/**
 * A lexical scope: local bindings from symbol name to value, plus an optional parent.
 *
 * <p>Environments are chained, never copied. A child created by {@link #extend(Map)} and
 * every closure defined in an environment hold a live reference to it, so a later
 * {@link #set} is visible to them. This is what lets a function defined with
 * {@code define} call itself.</p>
 *
 * <p>A bound value may be {@code null}, the result of {@code define}.</p>
 */
public final class Environment {

	private final Map<String, SxlNode> bindings;
	private final Environment parent;

	/**
	 * Creates an empty root environment.
	 */
	public Environment() {
		this(new HashMap<>(), null);
	}

	private Environment(Map<String, SxlNode> bindings, Environment parent) {
		this.bindings = bindings;
		this.parent = parent;
	}

	/**
	 * Looks the symbol up locally, then along the parent chain.
	 *
	 * @throws UnboundSymbolException if no environment in the chain binds the symbol
	 */
	public SxlNode lookup(String symbol) {
		Environment scope = this;
		while (scope != null) {
			if (scope.bindings.containsKey(symbol)) {
				return scope.bindings.get(symbol);
			}
			scope = scope.parent;
		}
		throw new UnboundSymbolException(symbol);
	}

	public SxlNode lookup(SxlNode.SymbolNode symbol) {
		return lookup(symbol.name());
	}

	/**
	 * Binds the symbol in this environment only, replacing any local binding.
	 * Parents are never touched.
	 */
	public void set(String symbol, SxlNode value) {
		Objects.requireNonNull(symbol, "symbol must not be null");
		bindings.put(symbol, value);
	}

	public void set(SxlNode.SymbolNode symbol, SxlNode value) {
		set(symbol.name(), value);
	}

	/**
	 * Creates a child environment whose local bindings are exactly {@code newBindings}
	 * and whose parent is this environment. This environment is not modified.
	 */
	public Environment extend(Map<String, SxlNode> newBindings) {
		Map<String, SxlNode> local = new HashMap<>();
		if (newBindings != null) {
			local.putAll(newBindings);
		}
		return new Environment(local, this);
	}

	public Optional<Environment> parent() {
		return Optional.ofNullable(parent);
	}

	public boolean isBoundLocally(String symbol) {
		return bindings.containsKey(symbol);
	}

	@Override
	public String toString() {
		return "Environment" + bindings.keySet() + (parent == null ? "" : " -> parent");
	}
}
