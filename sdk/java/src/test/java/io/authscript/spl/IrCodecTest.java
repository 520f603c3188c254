package io.authscript.spl;

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

import java.util.Map;
import java.util.Set;

class IrCodecTest {

    static PolicyIr sample() {
        return new SplCompiler().compile("""
            ROLE Admin { can: read, delete }
            USER alice { role: Admin, level: 3, ratio: 0.5, active: true }
            RESOURCE DB { path: "/data" }
            ALLOW action: delete ON RESOURCE: DB IF (user.role == "Admin" AND time.hour < 18)
            """).ir();
    }

    @Test void jsonRoundTrip() {
        PolicyIr ir = sample();
        assertEquals(ir, IrCodec.fromJson(IrCodec.toJson(ir)));
    }

    @Test void mapRoundTrip() {
        PolicyIr ir = sample();
        assertEquals(ir, IrCodec.fromMap(IrCodec.toMap(ir)));
    }

    @Test void mapShape() {
        Map<String, Object> map = IrCodec.toMap(sample());
        assertEquals(Set.of("roles", "users", "resources", "policies", "metadata"), map.keySet());
        Map<?, ?> metadata = (Map<?, ?>) map.get("metadata");
        assertEquals("1.0", metadata.get("version"));
    }

    @Test void malformedJsonFails() {
        assertThrows(SplException.class, () -> IrCodec.fromJson("{ not json"));
        assertThrows(SplException.class, () -> IrCodec.fromJson("{\"roles\": []}"));
    }
}
