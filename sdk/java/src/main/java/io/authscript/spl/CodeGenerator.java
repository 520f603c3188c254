package io.authscript.spl;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Lowers an analyzed program to {@link PolicyIr}. Output follows declaration order, so the
 * same program always produces an equal IR.
 *
 * <p>A program with roles but no ALLOW/DENY rules gets one synthesized ALLOW per role and
 * resource, guarded by {@code user.role == "<Role>"}. Roles without actions are skipped.
 */
public final class CodeGenerator implements Node.Visitor<Void> {
    private final CompilerOptions options;
    private final List<PolicyIr.Role> roles = new ArrayList<>();
    private final List<PolicyIr.User> users = new ArrayList<>();
    private final List<PolicyIr.Resource> resources = new ArrayList<>();
    private final List<PolicyIr.Policy> policies = new ArrayList<>();

    public CodeGenerator() {
        this(new CompilerOptions());
    }

    public CodeGenerator(CompilerOptions options) {
        this.options = Objects.requireNonNull(options, "options");
    }

    public PolicyIr generate(Node.Program program) {
        Objects.requireNonNull(program, "program");
        roles.clear();
        users.clear();
        resources.clear();
        policies.clear();

        program.accept(this);

        int synthesized = 0;
        if (policies.isEmpty() && options.synthesizeRolePolicies) {
            for (PolicyIr.Role role : roles) {
                if (role.permissions().isEmpty()) continue;
                String guard = ConditionPrinter.print(new Node.BinaryOp(Node.Operator.EQ,
                    new Node.Attribute("user", "role", role.line()),
                    new Node.Literal(role.name(), role.line()), role.line()));
                for (PolicyIr.Resource resource : resources) {
                    policies.add(new PolicyIr.Policy(Effect.ALLOW, role.permissions(), resource.name(),
                        guard, role.line(), true));
                    synthesized++;
                }
            }
        }

        PolicyIr.Counts counts = new PolicyIr.Counts(roles.size(), users.size(), resources.size(),
            policies.size(), synthesized);
        return new PolicyIr(roles, users, resources, policies,
            new PolicyIr.Metadata(PolicyIr.FORMAT_VERSION, counts));
    }

    @Override
    public Void visitProgram(Node.Program program) {
        for (Node.Statement s : program.statements()) s.accept(this);
        return null;
    }

    @Override
    public Void visitRole(Node.Role role) {
        roles.add(new PolicyIr.Role(role.name(), role.permissions(), role.properties(), role.line()));
        return null;
    }

    @Override
    public Void visitUser(Node.User user) {
        users.add(new PolicyIr.User(user.name(), user.text("role"), user.properties(), user.line()));
        return null;
    }

    @Override
    public Void visitResource(Node.Resource resource) {
        resources.add(new PolicyIr.Resource(resource.name(), resource.text("path"),
            resource.properties(), resource.line()));
        return null;
    }

    @Override
    public Void visitPolicy(Node.Policy policy) {
        policies.add(new PolicyIr.Policy(policy.effect(), policy.actions(), policy.resource(),
            ConditionPrinter.print(policy.condition()), policy.line(), false));
        return null;
    }
}
