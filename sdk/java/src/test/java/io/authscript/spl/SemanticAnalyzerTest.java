package io.authscript.spl;

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

class SemanticAnalyzerTest {

    static final String BASE = """
        ROLE Admin { can: * }
        ROLE Dev { can: read, write }
        USER alice { role: Admin }
        USER bob { role: Dev }
        RESOURCE DB { path: "/data/db" }
        """;

    static final String GUEST = """
        ROLE Guest { can: read }
        ROLE Admin { can: read, delete }
        RESOURCE DB { path: "/db" }
        """;

    static AnalysisResult analyze(String src) {
        return analyze(src, new CompilerOptions());
    }

    static AnalysisResult analyze(String src, CompilerOptions options) {
        Parser.Result parsed = Parser.parse(src);
        assertTrue(parsed.success(), () -> "unexpected diagnostics: " + parsed.diagnostics());
        return new SemanticAnalyzer(options).analyze(parsed.program());
    }

    static boolean hasMessage(List<Diagnostic> diagnostics, String text) {
        return diagnostics.stream().anyMatch(d -> d.message().contains(text));
    }

    @Test void cleanProgram() {
        AnalysisResult r = analyze(BASE + "ALLOW action: read ON RESOURCE: DB IF (user.role == \"Dev\")");
        assertTrue(r.success());
        assertTrue(r.errors().isEmpty());
        AnalysisResult.Statistics s = r.statistics();
        assertEquals(2, s.rolesDefined());
        assertEquals(2, s.usersDefined());
        assertEquals(1, s.resourcesDefined());
        assertEquals(1, s.policiesDefined());
        assertEquals(1, s.roleReferencesInConditions());
        assertEquals(0, s.undefinedReferences());
    }

    @Test void duplicateRoleIsBlocking() {
        AnalysisResult r = analyze("ROLE Admin { can: read }\nROLE Admin { can: write }");
        assertFalse(r.success());
        assertEquals("Duplicate role definition: 'Admin'", r.errors().get(0).message());
        assertEquals(2, r.errors().get(0).line());
    }

    @Test void sameNameDifferentKindsIsFine() {
        AnalysisResult r = analyze("ROLE Ops { can: read }\nUSER Ops { role: Ops }");
        assertTrue(r.success());
    }

    @Test void undefinedUserRoleIsErrorByDefault() {
        AnalysisResult r = analyze("USER carol { role: Ghost }");
        assertFalse(r.success());
        assertEquals("User 'carol' references undefined role 'Ghost'", r.errors().get(0).message());
        assertEquals(1, r.statistics().undefinedReferences());
    }

    @Test void lenientModeDowngradesRoleReferences() {
        AnalysisResult r = analyze("USER carol { role: Ghost }", CompilerOptions.lenient());
        assertTrue(r.success());
        assertTrue(hasMessage(r.warnings(), "references undefined role 'Ghost'"));
    }

    @Test void undefinedRoleInCondition() {
        AnalysisResult r = analyze(BASE + "ALLOW action: read ON RESOURCE: DB IF (user.role == \"Ghost\")");
        assertFalse(r.success());
        assertTrue(hasMessage(r.errors(), "Condition references undefined role 'Ghost'"));
    }

    @Test void userWithoutRoleWarns() {
        AnalysisResult r = analyze("USER dan { department: \"ops\" }");
        assertTrue(r.success());
        assertTrue(hasMessage(r.warnings(), "User 'dan' has no role assigned"));
    }

    @Test void undefinedResourceWarnsOnly() {
        AnalysisResult r = analyze(BASE + "ALLOW action: read ON RESOURCE: Files IF (user.role == \"Dev\")");
        assertTrue(r.success());
        Diagnostic d = r.warnings().stream()
            .filter(w -> w.message().equals("Policy references undefined resource 'Files'"))
            .findFirst().orElseThrow();
        assertEquals("define it with: RESOURCE Files { ... }", d.hint());
    }

    @Test void wildcardAndDottedSpecsAreNotResolved() {
        AnalysisResult r = analyze(BASE + """
            ALLOW action: read ON RESOURCE: * IF (user.role == "Dev")
            ALLOW action: read ON RESOURCE: reports.q1 IF (user.role == "Dev")
            """);
        assertEquals(0, r.statistics().undefinedReferences());
    }

    @Test void unmatchedPathWarns() {
        AnalysisResult r = analyze(BASE + "ALLOW action: read ON RESOURCE: \"/other\" IF (user.role == \"Dev\")");
        assertTrue(hasMessage(r.warnings(), "Policy uses path '/other'"));
        r = analyze(BASE + "ALLOW action: read ON RESOURCE: \"/data/db\" IF (user.role == \"Dev\")");
        assertFalse(hasMessage(r.warnings(), "Policy uses path"));
    }

    @Test void unknownAttributesWarn() {
        AnalysisResult r = analyze(BASE
            + "ALLOW action: read ON RESOURCE: DB IF (session.id == \"x\" AND time.second < 3)");
        assertTrue(r.success());
        assertTrue(hasMessage(r.warnings(), "Unknown object in attribute access: 'session'"));
        assertTrue(hasMessage(r.warnings(), "Unknown attribute 'second' on object 'time'"));
    }

    @Test void allowDenyConflict() {
        AnalysisResult r = analyze(BASE + """
            ALLOW action: read ON RESOURCE: DB IF (user.role == "Dev")
            DENY action: read ON RESOURCE: DB IF (user.role == "Dev")
            """);
        assertEquals(1, r.conflicts().size());
        PolicyConflict c = r.conflicts().get(0);
        assertEquals(ConflictType.ALLOW_DENY_CONFLICT, c.type());
        assertEquals(85, c.riskScore());
        assertEquals(6, c.policy1Line());
        assertEquals(7, c.policy2Line());
    }

    @Test void deleteConflictIsPrivilegeEscalation() {
        AnalysisResult r = analyze(BASE + """
            ALLOW action: delete ON RESOURCE: DB IF (user.role == "Admin")
            DENY action: delete ON RESOURCE: DB IF (time.hour > 20)
            """);
        assertEquals(ConflictType.PRIVILEGE_ESCALATION, r.conflicts().get(0).type());
        assertEquals(95, r.conflicts().get(0).riskScore());
    }

    @Test void disjointRoleConditionsDoNotConflict() {
        AnalysisResult r = analyze(BASE + """
            ALLOW action: read ON RESOURCE: DB IF (user.role == "Dev")
            DENY action: read ON RESOURCE: DB IF (user.role == "Admin" AND time.hour > 20)
            """);
        assertTrue(r.conflicts().isEmpty());
    }

    @Test void disjointActionsDoNotConflict() {
        AnalysisResult r = analyze(BASE + """
            ALLOW action: read ON RESOURCE: DB IF (user.role == "Dev")
            DENY action: write ON RESOURCE: DB IF (user.role == "Dev")
            """);
        assertTrue(r.conflicts().isEmpty());
    }

    @Test void identicalRulesAreRedundant() {
        AnalysisResult r = analyze(BASE + """
            ALLOW action: read ON RESOURCE: DB IF (user.role == "Dev")
            ALLOW action: read ON RESOURCE: DB IF ((user.role == "Dev"))
            """);
        assertEquals(ConflictType.REDUNDANT_POLICY, r.conflicts().get(0).type());
        assertEquals(20, r.conflicts().get(0).riskScore());
    }

    @Test void overlappingSameEffectRules() {
        AnalysisResult r = analyze(BASE + """
            ALLOW action: read ON RESOURCE: DB IF (user.role == "Dev")
            ALLOW action: * ON RESOURCE: DB IF (time.hour < 18)
            """);
        assertEquals(ConflictType.LOGICAL_CONTRADICTION, r.conflicts().get(0).type());
    }

    @Test void guestDeleteIsCritical() {
        AnalysisResult r = analyze("""
            ROLE Guest { can: read }
            RESOURCE DB { path: "/db" }
            ALLOW action: delete ON RESOURCE: DB IF (user.role == "Guest")
            """);
        assertFalse(r.success());
        assertTrue(hasMessage(r.errors(), "CRITICAL SECURITY RISK"));
    }

    @Test void guestDeleteThroughRolePermissions() {
        AnalysisResult r = analyze("""
            ROLE Guest { can: read, delete }
            RESOURCE DB { path: "/db" }
            """);
        assertFalse(r.success());
        assertTrue(hasMessage(r.errors(), "Role 'Guest' would be granted 'delete'"));
    }

    @Test void wildcardRoleIsRisk() {
        AnalysisResult r = analyze(BASE);
        Diagnostic d = r.warnings().get(0);
        assertEquals(Diagnostic.Severity.RISK, d.severity());
        assertEquals("SECURITY: Role 'Admin' has wildcard permissions (*)", d.message());
        assertEquals(1, r.statistics().securityRisks());
    }

    @Test void unguardedSensitiveAllow() {
        AnalysisResult r = analyze("RESOURCE DB { path: \"/db\" }\nALLOW action: read, delete ON RESOURCE: DB");
        assertTrue(r.success());
        assertTrue(hasMessage(r.warnings(), "Policy allows sensitive action(s) delete without conditions"));
        assertTrue(hasMessage(r.warnings(), "Policy grants sensitive actions without admin context"));
        assertEquals(2, r.statistics().securityRisks());
    }

    @Test void adminGuardSatisfiesSensitiveCheck() {
        AnalysisResult r = analyze(BASE + "ALLOW action: delete ON RESOURCE: DB IF (user.role == \"Admin\")");
        assertEquals(1, r.statistics().securityRisks());
    }

    @Test void unguardedSensitiveDenyIsRisk() {
        AnalysisResult r = analyze("RESOURCE DB { path: \"/db\" }\nDENY action: delete ON RESOURCE: DB");
        assertTrue(r.success());
        assertTrue(hasMessage(r.warnings(), "Policy denies sensitive action(s) delete without conditions"));
        assertFalse(hasMessage(r.warnings(), "without admin context"));
        assertEquals(1, r.statistics().securityRisks());
    }

    @Test void guardedSensitiveDenyIsNotARisk() {
        AnalysisResult r = analyze("RESOURCE DB { path: \"/db\" }\nDENY action: delete ON RESOURCE: DB IF (time.hour > 20)");
        assertEquals(0, r.statistics().securityRisks());
    }

    @Test void unconditionedDeleteReachesGuest() {
        AnalysisResult r = analyze(GUEST + "ALLOW action: delete ON RESOURCE: DB");
        assertFalse(r.success());
        assertTrue(hasMessage(r.errors(), "CRITICAL SECURITY RISK"));
    }

    @Test void excludingAnotherRoleStillReachesGuest() {
        AnalysisResult r = analyze(GUEST + "ALLOW action: delete ON RESOURCE: DB IF (user.role != \"Admin\")");
        assertFalse(r.success());
        assertTrue(hasMessage(r.errors(), "CRITICAL SECURITY RISK"));
    }

    @Test void wildcardGrantReachesGuest() {
        AnalysisResult r = analyze(GUEST + "ALLOW action: * ON RESOURCE: DB IF (time.hour < 18)");
        assertTrue(hasMessage(r.errors(), "CRITICAL SECURITY RISK"));
    }

    @Test void guestInsideOrIsReachable() {
        AnalysisResult r = analyze(GUEST
            + "ALLOW action: delete ON RESOURCE: DB IF (user.role == \"Admin\" OR user.role == \"Guest\")");
        assertTrue(hasMessage(r.errors(), "CRITICAL SECURITY RISK"));
    }

    @Test void pinnedToNonGuestRoleIsSafe() {
        AnalysisResult r = analyze(GUEST
            + "ALLOW action: delete ON RESOURCE: DB IF (user.role == \"Admin\" AND time.hour < 18)");
        assertTrue(r.success(), () -> r.errors().toString());
    }

    @Test void bothSpellingsOfExcludingGuestAgree() {
        AnalysisResult ne = analyze(GUEST + "ALLOW action: delete ON RESOURCE: DB IF (user.role != \"Guest\")");
        AnalysisResult not = analyze(GUEST + "ALLOW action: delete ON RESOURCE: DB IF (NOT user.role == \"Guest\")");
        assertTrue(ne.success(), () -> ne.errors().toString());
        assertTrue(not.success(), () -> not.errors().toString());
        assertEquals(ne.statistics().securityRisks(), not.statistics().securityRisks());
    }

    @Test void deleteWithoutGuestRoleIsNotCritical() {
        AnalysisResult r = analyze("ROLE Dev { can: read }\nRESOURCE DB { path: \"/db\" }\n"
            + "ALLOW action: delete ON RESOURCE: DB IF (user.role != \"Dev\")");
        assertTrue(r.success());
    }

    @Test void recommendationsBecomeWarnings() {
        CompilerOptions options = new CompilerOptions();
        options.recommendations.add((program, symbols) ->
            symbols.symbols(SymbolKind.USER).isEmpty()
                ? List.of(Diagnostic.warning(0, "no users defined"))
                : List.of());
        AnalysisResult r = analyze("ROLE Viewer { can: read }", options);
        assertTrue(hasMessage(r.warnings(), "no users defined"));
    }

    @Test void analyzerIsSingleUse() {
        Node.Program p = Parser.parse("ROLE A { can: read }").program();
        SemanticAnalyzer analyzer = new SemanticAnalyzer();
        analyzer.analyze(p);
        assertThrows(SplException.class, () -> analyzer.analyze(p));
    }
}
