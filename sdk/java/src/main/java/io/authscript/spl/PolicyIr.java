package io.authscript.spl;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Compiled policy: the only compiler artifact that outlives a compile call. Immutable;
 * collections keep declaration order. Serialized by {@link IrCodec}.
 */
public record PolicyIr(List<Role> roles, List<User> users, List<Resource> resources,
                       List<Policy> policies, Metadata metadata) {

    public static final String FORMAT_VERSION = "1.0";

    public PolicyIr {
        roles = List.copyOf(roles);
        users = List.copyOf(users);
        resources = List.copyOf(resources);
        policies = List.copyOf(policies);
        Objects.requireNonNull(metadata, "metadata");
    }

    public record Role(String name, List<String> permissions, Map<String, List<Object>> properties,
                       int line) {
        public Role {
            Objects.requireNonNull(name, "name");
            permissions = List.copyOf(permissions);
            properties = copy(properties);
        }
    }

    /** @param role assigned role name, or null when the user has none */
    public record User(String name, String role, Map<String, List<Object>> properties, int line) {
        public User {
            Objects.requireNonNull(name, "name");
            properties = copy(properties);
        }
    }

    /** @param path declared path, or null */
    public record Resource(String name, String path, Map<String, List<Object>> properties, int line) {
        public Resource {
            Objects.requireNonNull(name, "name");
            properties = copy(properties);
        }
    }

    /**
     * @param condition normalized condition text, or null for an unconditional rule
     * @param synthesized true for rules generated from role permissions
     */
    public record Policy(Effect effect, List<String> actions, String resource, String condition,
                         int line, boolean synthesized) {
        public Policy {
            Objects.requireNonNull(effect, "effect");
            Objects.requireNonNull(resource, "resource");
            actions = List.copyOf(actions);
        }
    }

    public record Metadata(String version, Counts counts) {}

    public record Counts(int roles, int users, int resources, int policies, int synthesized) {}

    private static Map<String, List<Object>> copy(Map<String, List<Object>> properties) {
        if (properties == null) return Map.of();
        Map<String, List<Object>> out = new LinkedHashMap<>();
        properties.forEach((k, v) -> out.put(k, List.copyOf(v)));
        return Collections.unmodifiableMap(out);
    }
}
