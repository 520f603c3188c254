package io.authscript.spl;

public enum SymbolKind {
    ROLE,
    USER,
    RESOURCE,
    /** Built-in attribute namespace readable in conditions, e.g. {@code time}. */
    VARIABLE
}
