package io.authscript.spl.engine;

import java.util.List;

/**
 * What a user may be able to do. {@code applicablePolicies} is a superset: every rule without
 * a condition plus every rule whose condition reads {@code user.role}.
 *
 * @param role assigned role, or null when the user has none
 */
public record PermissionView(String username, String role, List<String> rolePermissions,
                             List<MatchedPolicy> applicablePolicies) {
    public PermissionView {
        rolePermissions = List.copyOf(rolePermissions);
        applicablePolicies = List.copyOf(applicablePolicies);
    }
}
