package io.authscript.spl;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Scoped bindings built during semantic analysis. The global scope is seeded with the
 * attribute namespaces conditions may read.
 */
public final class SymbolTable {
    /** Readable fields of each built-in namespace. */
    public static final Map<String, List<String>> BUILTIN_NAMESPACES;

    static {
        Map<String, List<String>> ns = new LinkedHashMap<>();
        ns.put("user", List.of("role", "name", "id", "department", "clearance", "location"));
        ns.put("time", List.of("hour", "minute", "day", "month", "year", "weekday"));
        ns.put("request", List.of("ip", "method", "path", "headers", "user_agent"));
        ns.put("resource", List.of("path", "type", "owner", "sensitivity"));
        ns.put("device", List.of("type", "id", "os", "browser", "location", "trusted"));
        BUILTIN_NAMESPACES = Collections.unmodifiableMap(ns);
    }

    private final Scope global = new Scope("global", 0, null);
    private final List<Scope> scopes = new ArrayList<>();
    private Scope current = global;

    public SymbolTable() {
        scopes.add(global);
        BUILTIN_NAMESPACES.forEach((name, fields) ->
            global.define(name, SymbolKind.VARIABLE,
                Map.<String, List<Object>>of("fields", List.copyOf(fields)), 0));
    }

    public Scope global() {
        return global;
    }

    public Scope current() {
        return current;
    }

    public Scope enterScope(String name) {
        current = new Scope(name, current.level() + 1, current);
        scopes.add(current);
        return current;
    }

    public void exitScope() {
        if (current.parent() != null) current = current.parent();
    }

    public Symbol define(String name, SymbolKind kind, Map<String, List<Object>> attributes, int line) {
        return current.define(name, kind, attributes, line);
    }

    public Symbol lookup(SymbolKind kind, String name) {
        return current.lookup(kind, name);
    }

    public Symbol resolve(SymbolKind kind, String name) {
        return current.resolve(kind, name);
    }

    public boolean isDefined(SymbolKind kind, String name) {
        return resolve(kind, name) != null;
    }

    /** Every symbol of one kind across all scopes ever entered, in definition order. */
    public List<Symbol> symbols(SymbolKind kind) {
        List<Symbol> result = new ArrayList<>();
        for (Scope scope : scopes) {
            for (Symbol s : scope.symbols()) {
                if (s.kind() == kind) result.add(s);
            }
        }
        return result;
    }

    public List<Scope> scopes() {
        return Collections.unmodifiableList(scopes);
    }

    /** Scopes from global down to the current one. */
    public List<Scope> scopeChain() {
        List<Scope> chain = new ArrayList<>();
        for (Scope s = current; s != null; s = s.parent()) chain.add(0, s);
        return chain;
    }

    public boolean isNamespace(String name) {
        return resolve(SymbolKind.VARIABLE, name) != null;
    }

    public boolean hasField(String namespace, String field) {
        Symbol ns = resolve(SymbolKind.VARIABLE, namespace);
        return ns != null && ns.attributes().getOrDefault("fields", List.of()).contains(field);
    }

    public Set<String> namespaces() {
        return BUILTIN_NAMESPACES.keySet();
    }
}
