package io.authscript.spl.engine;

import io.authscript.spl.Effect;

import java.util.List;

/** A rule that matched during an access check. */
public record MatchedPolicy(Effect effect, List<String> actions, String resource, String condition,
                            int line) {
    public MatchedPolicy {
        actions = List.copyOf(actions);
    }
}
