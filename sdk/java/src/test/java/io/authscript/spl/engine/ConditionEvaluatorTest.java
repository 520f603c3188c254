package io.authscript.spl.engine;

import io.authscript.spl.Node;
import io.authscript.spl.Parser;
import io.authscript.spl.SplException;
import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

class ConditionEvaluatorTest {

    static EvaluationContext ctx() {
        Map<String, Map<String, Object>> ns = new LinkedHashMap<>();
        Map<String, Object> user = new HashMap<>();
        user.put("role", "Admin");
        user.put("clearance", 3L);
        user.put("id", "42");
        ns.put("user", user);
        Map<String, Object> time = new HashMap<>();
        time.put("hour", 9);
        time.put("day", "Monday");
        ns.put("time", time);
        Map<String, Object> request = new HashMap<>();
        request.put("headers", Map.of("x", "y"));
        request.put("path", "/a");
        ns.put("request", request);
        Map<String, Object> device = new HashMap<>();
        device.put("trusted", true);
        ns.put("device", device);
        return new EvaluationContext(ns);
    }

    static boolean test(String condition) {
        return new ConditionEvaluator(ctx()).test(Parser.parseCondition(condition));
    }

    @Test void equality() {
        assertTrue(test("user.role == \"Admin\""));
        assertTrue(test("user.role != 'Dev'"));
        assertTrue(test("device.trusted == true"));
        assertFalse(test("device.trusted == false"));
    }

    @Test void numbersCompareNumerically() {
        assertTrue(test("time.hour == 9"));
        assertTrue(test("time.hour == 9.0"));
        assertTrue(test("user.clearance >= 3"));
        assertTrue(test("time.hour < 17.5"));
    }

    @Test void scalarsOfMixedTypeCompareAsText() {
        assertTrue(test("user.id == 42"));
        assertTrue(test("user.id > 41"));
    }

    @Test void stringsOrderLexicographically() {
        assertTrue(test("request.path < \"/b\""));
    }

    @Test void mapsNeverEqual() {
        assertFalse(test("request.headers == \"{x=y}\""));
        assertTrue(test("request.headers != \"{x=y}\""));
    }

    @Test void quotedTextIsNotAnAttribute() {
        assertFalse(test("user.role == \"user.role\""));
    }

    @Test void logic() {
        assertTrue(test("user.role == \"Admin\" AND NOT time.day == \"Sunday\""));
        assertTrue(test("user.role == \"Dev\" OR time.hour < 12"));
        assertFalse(test("NOT (time.hour < 12 OR user.role == \"Dev\")"));
    }

    @Test void shortCircuitSkipsUnknownAttributes() {
        assertFalse(test("user.role == \"Dev\" AND session.id == 1"));
        assertTrue(test("user.role == \"Admin\" OR session.id == 1"));
    }

    @Test void failuresAreFalse() {
        assertFalse(test("session.id == 1"));
        assertFalse(test("user.shoe == 1"));
        assertFalse(test("user.role < 3"));
        assertFalse(test("device.trusted > false"));
        assertFalse(test("time.hour AND device.trusted"));
        assertFalse(test("time.hour"));
        assertFalse(test("NOT user.role"));
    }

    @Test void evalRaises() {
        ConditionEvaluator ev = new ConditionEvaluator(ctx());
        assertThrows(SplException.class, () -> ev.eval(Parser.parseCondition("session.id == 1")));
    }

    @Test void gasBudget() {
        Node.Expr e = Parser.parseCondition("time.hour == 9");
        assertFalse(new ConditionEvaluator(ctx(), 2).test(e));
        assertTrue(new ConditionEvaluator(ctx(), 3).test(e));
    }

    @Test void depthLimit() {
        StringBuilder src = new StringBuilder();
        for (int i = 0; i < ConditionEvaluator.MAX_DEPTH; i++) src.append("NOT ");
        src.append("device.trusted == true");
        assertFalse(new ConditionEvaluator(ctx()).test(Parser.parseCondition(src.toString())));
    }
}
