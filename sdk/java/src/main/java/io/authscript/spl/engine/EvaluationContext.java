package io.authscript.spl.engine;

import io.authscript.spl.SplException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Attribute values visible to one access check, grouped by namespace.
 */
public final class EvaluationContext {
    private final Map<String, Map<String, Object>> namespaces;

    EvaluationContext(Map<String, Map<String, Object>> namespaces) {
        Map<String, Map<String, Object>> copy = new LinkedHashMap<>();
        namespaces.forEach((k, v) -> copy.put(k, Collections.unmodifiableMap(new LinkedHashMap<>(v))));
        this.namespaces = Collections.unmodifiableMap(copy);
    }

    /** @throws SplException if the namespace or the field does not exist */
    public Object lookup(String namespace, String field) {
        Map<String, Object> ns = namespaces.get(namespace);
        if (ns == null) throw new SplException("unknown namespace: " + namespace);
        if (!ns.containsKey(field)) throw new SplException("unknown attribute: " + namespace + "." + field);
        return ns.get(field);
    }

    public Map<String, Map<String, Object>> asMap() {
        return namespaces;
    }
}
