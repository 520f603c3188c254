package io.authscript.spl;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One level of name bindings. Names are unique per {@link SymbolKind}, so a role and a user
 * may share a name.
 */
public final class Scope {
    private final String name;
    private final int level;
    private final Scope parent;
    private final Map<SymbolKind, Map<String, Symbol>> bindings = new EnumMap<>(SymbolKind.class);

    Scope(String name, int level, Scope parent) {
        this.name = name;
        this.level = level;
        this.parent = parent;
    }

    public String name() {
        return name;
    }

    public int level() {
        return level;
    }

    public Scope parent() {
        return parent;
    }

    Symbol define(String symbolName, SymbolKind kind, Map<String, List<Object>> attributes, int line) {
        Symbol symbol = new Symbol(symbolName, kind, attributes, line, level);
        bindings.computeIfAbsent(kind, k -> new LinkedHashMap<>()).put(symbolName, symbol);
        return symbol;
    }

    /** Looks in this scope only. */
    public Symbol lookup(SymbolKind kind, String symbolName) {
        Map<String, Symbol> ofKind = bindings.get(kind);
        return ofKind == null ? null : ofKind.get(symbolName);
    }

    /** Looks in this scope, then each enclosing scope. */
    public Symbol resolve(SymbolKind kind, String symbolName) {
        for (Scope s = this; s != null; s = s.parent) {
            Symbol found = s.lookup(kind, symbolName);
            if (found != null) return found;
        }
        return null;
    }

    public List<Symbol> symbols() {
        List<Symbol> all = new ArrayList<>();
        bindings.values().forEach(m -> all.addAll(m.values()));
        return Collections.unmodifiableList(all);
    }

    @Override
    public String toString() {
        return "Scope(" + name + ", level=" + level + ", symbols=" + symbols().size() + ")";
    }
}
