package io.authscript.spl;

import java.util.List;
import java.util.Map;

/**
 * A name bound in a {@link Scope}.
 *
 * @param attributes the definition's properties; for built-in namespaces the single key
 *                   {@code fields} lists the readable fields
 * @param line defining line, 0 for built-ins
 * @param scopeLevel depth of the defining scope, 0 being global
 */
public record Symbol(String name, SymbolKind kind, Map<String, List<Object>> attributes,
                     int line, int scopeLevel) {

    @Override
    public String toString() {
        return "Symbol(" + name + ", " + kind + ", level " + scopeLevel + ")";
    }
}
