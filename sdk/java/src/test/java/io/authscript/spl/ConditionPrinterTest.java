package io.authscript.spl;

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

class ConditionPrinterTest {

    static String normalize(String condition) {
        return ConditionPrinter.print(Parser.parseCondition(condition));
    }

    @Test void nullPrintsNull() {
        assertNull(ConditionPrinter.print(null));
    }

    @Test void dropsRedundantParentheses() {
        assertEquals("user.role == \"Admin\" AND time.hour < 18",
            normalize("((user.role == 'Admin') AND (time.hour < 18))"));
    }

    @Test void keepsParenthesesPrecedenceNeeds() {
        assertEquals("(a.x == 1 OR a.y == 2) AND a.z == 3", normalize("(a.x == 1 OR a.y == 2) AND a.z == 3"));
        assertEquals("NOT (a.x == 1 AND a.y == 2)", normalize("NOT (a.x == 1 AND a.y == 2)"));
        assertEquals("a.x == 1 AND (a.y == 2 AND a.z == 3)", normalize("a.x == 1 AND (a.y == 2 AND a.z == 3)"));
    }

    @Test void escapesStrings() {
        assertEquals("user.name == \"a\\\"b\"", normalize("user.name == 'a\"b'"));
    }

    @Test void numbersAndBooleans() {
        assertEquals("time.hour >= 9 AND device.trusted == true AND x.y < 2.5",
            normalize("time.hour >= 9 AND device.trusted == true AND x.y < 2.5"));
    }

    @Test void printedTextIsAFixpoint() {
        String[] conditions = {
            "NOT user.role == \"Guest\" OR time.hour < 6",
            "(user.role == 'Admin' OR user.role == 'Dev') AND NOT (device.trusted == false)",
            "request.method != \"DELETE\" AND time.weekday == Monday",
        };
        for (String c : conditions) {
            String once = normalize(c);
            assertEquals(once, normalize(once), c);
        }
    }
}
