package io.authscript.spl;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Semantic checks over a parsed program, run as five ordered passes:
 * <ol>
 *   <li>collection: bind every definition, reject duplicates per kind;</li>
 *   <li>validation: resolve role, resource and attribute references;</li>
 *   <li>conflict detection between rules on the same resource;</li>
 *   <li>security analysis: wildcard grants, guest deletes, unguarded sensitive actions;</li>
 *   <li>recommendations supplied through {@link CompilerOptions#recommendations}.</li>
 * </ol>
 * An analyzer instance checks a single program.
 */
public final class SemanticAnalyzer implements Node.Visitor<Void> {
    private static final Logger log = LoggerFactory.getLogger(SemanticAnalyzer.class);

    static final Set<String> SENSITIVE_ACTIONS = Set.of("delete", "execute", "update");
    static final List<String> ADMIN_MARKERS = List.of("admin");

    private final CompilerOptions options;
    private final SymbolTable symbols = new SymbolTable();
    private final List<Diagnostic> errors = new ArrayList<>();
    private final List<Diagnostic> warnings = new ArrayList<>();
    private final List<PolicyConflict> conflicts = new ArrayList<>();

    private final Map<String, Node.Role> roles = new LinkedHashMap<>();
    private final Map<String, Node.User> users = new LinkedHashMap<>();
    private final Map<String, Node.Resource> resources = new LinkedHashMap<>();
    private final List<Node.Policy> policies = new ArrayList<>();
    private final List<Node.Role> wildcardRoles = new ArrayList<>();

    private int undefinedReferences;
    private int roleReferencesInConditions;
    private int securityRisks;
    private boolean used;

    public SemanticAnalyzer() {
        this(new CompilerOptions());
    }

    public SemanticAnalyzer(CompilerOptions options) {
        this.options = Objects.requireNonNull(options, "options");
    }

    public AnalysisResult analyze(Node.Program program) {
        Objects.requireNonNull(program, "program");
        if (used) throw new SplException("a SemanticAnalyzer checks a single program");
        used = true;

        program.accept(this);
        validateReferences();
        detectConflicts();
        analyzeSecurity();
        recommend(program);

        log.debug("Semantic analysis finished: {} error(s), {} warning(s), {} conflict(s)",
            errors.size(), warnings.size(), conflicts.size());

        AnalysisResult.Statistics stats = new AnalysisResult.Statistics(
            roles.size(), users.size(), resources.size(), policies.size(), conflicts.size(),
            undefinedReferences, roleReferencesInConditions, securityRisks);
        return new AnalysisResult(errors.isEmpty(), errors, warnings, conflicts, stats, symbols);
    }

    // --- pass 1: collection ---

    @Override
    public Void visitProgram(Node.Program program) {
        for (Node.Statement statement : program.statements()) statement.accept(this);
        return null;
    }

    @Override
    public Void visitRole(Node.Role role) {
        if (collect(roles, role, SymbolKind.ROLE, "role") && role.permissions().contains("*")) {
            wildcardRoles.add(role);
        }
        return null;
    }

    @Override
    public Void visitUser(Node.User user) {
        collect(users, user, SymbolKind.USER, "user");
        return null;
    }

    @Override
    public Void visitResource(Node.Resource resource) {
        collect(resources, resource, SymbolKind.RESOURCE, "resource");
        return null;
    }

    @Override
    public Void visitPolicy(Node.Policy policy) {
        policies.add(policy);
        return null;
    }

    private <T extends Node.Definition> boolean collect(Map<String, T> seen, T def, SymbolKind kind,
                                                        String label) {
        if (symbols.lookup(kind, def.name()) != null) {
            errors.add(Diagnostic.error(def.line(),
                "Duplicate " + label + " definition: '" + def.name() + "'"));
            return false;
        }
        seen.put(def.name(), def);
        symbols.define(def.name(), kind, def.properties(), def.line());
        return true;
    }

    // --- pass 2: validation ---

    private void validateReferences() {
        for (Node.User user : users.values()) {
            String role = user.text("role");
            if (role == null) {
                warnings.add(Diagnostic.warning(user.line(),
                    "User '" + user.name() + "' has no role assigned"));
            } else if (!symbols.isDefined(SymbolKind.ROLE, role)) {
                undefinedReferences++;
                roleReference(user.line(),
                    "User '" + user.name() + "' references undefined role '" + role + "'");
            }
        }

        for (Node.Policy policy : policies) {
            validateResourceReference(policy);
            if (policy.condition() != null) {
                symbols.enterScope("policy@" + policy.line());
                policy.condition().accept(new ConditionChecker());
                symbols.exitScope();
            }
        }
    }

    private void validateResourceReference(Node.Policy policy) {
        String spec = policy.resource();
        boolean wildcard = spec.contains("*");
        if (spec.startsWith("/")) {
            if (!wildcard && resources.values().stream().noneMatch(r -> spec.equals(r.text("path")))) {
                warnings.add(Diagnostic.warning(policy.line(),
                    "Policy uses path '" + spec + "' which doesn't match any defined resource path"));
            }
        } else if (!wildcard && !spec.contains(".")
                && !symbols.isDefined(SymbolKind.RESOURCE, spec)) {
            undefinedReferences++;
            warnings.add(Diagnostic.warning(policy.line(),
                    "Policy references undefined resource '" + spec + "'")
                .withHint("define it with: RESOURCE " + spec + " { ... }"));
        }
    }

    private void roleReference(int line, String message) {
        if (options.strictRoleReferences) {
            errors.add(Diagnostic.error(line, message));
        } else {
            warnings.add(Diagnostic.warning(line, message));
        }
    }

    /** Checks attribute accesses and role literals inside one rule's condition. */
    private final class ConditionChecker implements Node.Expr.Visitor<Void> {
        @Override
        public Void visitBinary(Node.BinaryOp node) {
            node.left().accept(this);
            node.right().accept(this);
            if (node.op().isEquality()) {
                String role = roleLiteral(node);
                if (role != null) {
                    roleReferencesInConditions++;
                    if (!symbols.isDefined(SymbolKind.ROLE, role)) {
                        undefinedReferences++;
                        roleReference(node.line(), "Condition references undefined role '" + role
                            + "' in condition at line " + node.line());
                    }
                }
            }
            return null;
        }

        @Override
        public Void visitUnary(Node.UnaryOp node) {
            return node.operand().accept(this);
        }

        @Override
        public Void visitAttribute(Node.Attribute node) {
            if (!symbols.isNamespace(node.object())) {
                warnings.add(Diagnostic.warning(node.line(),
                    "Unknown object in attribute access: '" + node.object() + "'"));
            } else if (!symbols.hasField(node.object(), node.field())) {
                warnings.add(Diagnostic.warning(node.line(),
                    "Unknown attribute '" + node.field() + "' on object '" + node.object() + "'"));
            }
            return null;
        }

        @Override
        public Void visitLiteral(Node.Literal node) {
            return null;
        }
    }

    /** The role name in {@code user.role == "X"} or {@code "X" != user.role}, else null. */
    static String roleLiteral(Node.BinaryOp node) {
        if (isUserRole(node.left()) && node.right() instanceof Node.Literal lit
                && lit.value() instanceof String s) {
            return s;
        }
        if (isUserRole(node.right()) && node.left() instanceof Node.Literal lit
                && lit.value() instanceof String s) {
            return s;
        }
        return null;
    }

    private static boolean isUserRole(Node.Expr expr) {
        return expr instanceof Node.Attribute a && a.object().equals("user") && a.field().equals("role");
    }

    // --- pass 3: conflicts ---

    private void detectConflicts() {
        Map<String, List<Node.Policy>> byResource = new LinkedHashMap<>();
        for (Node.Policy p : policies) {
            byResource.computeIfAbsent(p.resource(), k -> new ArrayList<>()).add(p);
        }
        for (List<Node.Policy> group : byResource.values()) {
            for (int i = 0; i < group.size(); i++) {
                for (int j = i + 1; j < group.size(); j++) {
                    Node.Policy a = group.get(i);
                    Node.Policy b = group.get(j);
                    List<String> shared = sharedActions(a, b);
                    if (shared.isEmpty() || ConditionOverlap.provablyDisjoint(a.condition(), b.condition())) {
                        continue;
                    }
                    conflicts.add(classify(a, b, String.join(", ", shared)));
                }
            }
        }
    }

    private static PolicyConflict classify(Node.Policy a, Node.Policy b, String actions) {
        if (a.effect() != b.effect()) {
            ConflictType type = a.actions().contains("delete") || b.actions().contains("delete")
                ? ConflictType.PRIVILEGE_ESCALATION
                : ConflictType.ALLOW_DENY_CONFLICT;
            return new PolicyConflict(a, b, type, "Conflicting policies on resource '" + a.resource()
                + "' for action(s) " + actions + ": " + a.effect() + " (line " + a.line() + ") vs "
                + b.effect() + " (line " + b.line() + ")");
        }
        if (Objects.equals(ConditionPrinter.print(a.condition()), ConditionPrinter.print(b.condition()))) {
            return new PolicyConflict(a, b, ConflictType.REDUNDANT_POLICY, a.effect()
                + " policy at line " + b.line() + " repeats line " + a.line() + " on resource '"
                + a.resource() + "' for action(s) " + actions);
        }
        return new PolicyConflict(a, b, ConflictType.LOGICAL_CONTRADICTION, "Overlapping "
            + a.effect() + " policies on resource '" + a.resource() + "' for action(s) " + actions
            + " (lines " + a.line() + " and " + b.line() + ")");
    }

    static List<String> sharedActions(Node.Policy a, Node.Policy b) {
        boolean aAll = a.actions().contains("*");
        boolean bAll = b.actions().contains("*");
        if (aAll && bAll) return List.of("*");
        if (aAll) return b.actions();
        if (bAll) return a.actions();
        return a.actions().stream().filter(b.actions()::contains).toList();
    }

    // --- pass 4: security ---

    private void analyzeSecurity() {
        for (Node.Role role : wildcardRoles) {
            securityRisks++;
            warnings.add(Diagnostic.risk(role.line(),
                "SECURITY: Role '" + role.name() + "' has wildcard permissions (*)"));
        }

        for (Node.Policy policy : policies) {
            List<String> sensitive = sensitiveActions(policy.actions());
            if (!sensitive.isEmpty() && policy.condition() == null) {
                securityRisks++;
                warnings.add(Diagnostic.risk(policy.line(), "Policy "
                    + (policy.effect() == Effect.ALLOW ? "allows" : "denies") + " sensitive action(s) "
                    + String.join(", ", sensitive) + " without conditions"));
            }
            if (policy.effect() != Effect.ALLOW) continue;

            if (policy.grants("delete") && reachableByGuest(policy.condition())) {
                securityRisks++;
                errors.add(Diagnostic.error(policy.line(),
                    "CRITICAL SECURITY RISK: Policy grants 'delete' to Guest role"));
            }
            if (!sensitive.isEmpty() && !isAdminContext(policy.condition())) {
                securityRisks++;
                warnings.add(Diagnostic.risk(policy.line(),
                    "Policy grants sensitive actions without admin context"));
            }
        }

        // without explicit rules every role is granted its own actions on every resource
        if (policies.isEmpty() && options.synthesizeRolePolicies && !resources.isEmpty()) {
            for (Node.Role role : roles.values()) {
                List<String> perms = role.permissions();
                if (isGuest(role.name()) && (perms.contains("delete") || perms.contains("*"))) {
                    securityRisks++;
                    errors.add(Diagnostic.error(role.line(), "CRITICAL SECURITY RISK: Role '"
                        + role.name() + "' would be granted 'delete' by implicit role policies"));
                }
            }
        }
    }

    private static List<String> sensitiveActions(List<String> actions) {
        if (actions.contains("*")) return List.of("*");
        return actions.stream().filter(SENSITIVE_ACTIONS::contains).toList();
    }

    /**
     * Whether a guest role can satisfy the condition. Only top-level AND conjuncts on
     * {@code user.role} narrow the answer: a pin to a non-guest role rules guests out and
     * {@code !=} or {@code NOT ==} rules a single role out. Anything else is assumed reachable
     * when a guest role is defined.
     */
    private boolean reachableByGuest(Node.Expr condition) {
        List<String> guests = roles.keySet().stream().filter(SemanticAnalyzer::isGuest).toList();
        if (condition == null) return !guests.isEmpty();

        List<String> pinned = new ArrayList<>();
        Set<String> excluded = new HashSet<>();
        for (Node.Expr conjunct : conjuncts(condition, new ArrayList<>())) {
            if (conjunct instanceof Node.BinaryOp b && b.op().isEquality()) {
                String role = roleLiteral(b);
                if (role == null) continue;
                if (b.op() == Node.Operator.EQ) pinned.add(role);
                else excluded.add(role);
            } else if (conjunct instanceof Node.UnaryOp u && u.operand() instanceof Node.BinaryOp b
                    && b.op() == Node.Operator.EQ) {
                String role = roleLiteral(b);
                if (role != null) excluded.add(role);
            }
        }
        if (!pinned.isEmpty()) return pinned.stream().allMatch(SemanticAnalyzer::isGuest);
        if (mentionsGuestRole(condition)) return true;
        return guests.stream().anyMatch(g -> !excluded.contains(g));
    }

    private static List<Node.Expr> conjuncts(Node.Expr expr, List<Node.Expr> out) {
        if (expr instanceof Node.BinaryOp b && b.op() == Node.Operator.AND) {
            conjuncts(b.left(), out);
            conjuncts(b.right(), out);
        } else {
            out.add(expr);
        }
        return out;
    }

    /** A {@code user.role == "<guest>"} comparison that is not negated. */
    private static boolean mentionsGuestRole(Node.Expr expr) {
        if (!(expr instanceof Node.BinaryOp b)) return false;
        if (b.op() == Node.Operator.EQ) {
            String role = roleLiteral(b);
            return role != null && isGuest(role);
        }
        return b.op().isLogical() && (mentionsGuestRole(b.left()) || mentionsGuestRole(b.right()));
    }

    private static boolean isGuest(String roleName) {
        return roleName.toLowerCase(Locale.ROOT).contains("guest");
    }

    private static boolean isAdminContext(Node.Expr condition) {
        if (condition == null) return false;
        String text = ConditionPrinter.print(condition).toLowerCase(Locale.ROOT);
        return ADMIN_MARKERS.stream().anyMatch(text::contains);
    }

    // --- pass 5: recommendations ---

    private void recommend(Node.Program program) {
        for (CompilerOptions.Recommendation r : options.recommendations) {
            warnings.addAll(r.review(program, symbols));
        }
    }
}
