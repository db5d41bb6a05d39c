package io.github.manjago.pieasm.core;

import org.jetbrains.annotations.NotNull;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalLong;

/**
 * Label name to offset mapping for one assembly run.
 * <p>
 * Names are unique: adding an existing name is rejected, never overwritten.
 * Callers check {@link #has(String)} first and report the collision themselves.
 */
public final class SymbolTable {

    private final Map<String, Symbol> symbols = new LinkedHashMap<>();

    /**
     * Insert a new symbol.
     *
     * @throws IllegalStateException if the name is already present
     */
    public void add(@NotNull Symbol symbol) {
        Symbol previous = symbols.putIfAbsent(symbol.name(), symbol);
        if (previous != null) {
            throw new IllegalStateException("Symbol already declared: " + symbol.name());
        }
    }

    public boolean has(@NotNull String name) {
        return symbols.containsKey(name);
    }

    public OptionalLong lookup(@NotNull String name) {
        Symbol s = symbols.get(name);
        return s == null ? OptionalLong.empty() : OptionalLong.of(s.offset());
    }

    /**
     * Patch the offset of an already declared symbol.
     *
     * @throws IllegalStateException if the name is unknown
     */
    public void setOffset(@NotNull String name, long offset) {
        Symbol s = symbols.get(name);
        if (s == null) {
            throw new IllegalStateException("Unknown symbol: " + name);
        }
        symbols.put(name, s.withOffset(offset));
    }

    public int size() {
        return symbols.size();
    }

    /** Symbols in declaration order. */
    public Collection<Symbol> symbols() {
        return Collections.unmodifiableCollection(symbols.values());
    }

    @Override
    public String toString() {
        return "SymbolTable" + symbols.values();
    }
}
