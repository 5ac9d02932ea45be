package com.contentforge.domain.content.model.valobj;

import java.util.List;

/**
 * Outcome of an invariant check.
 */
public record GateResult(boolean ok, List<String> problems) {

    public GateResult {
        problems = problems == null ? List.of() : List.copyOf(problems);
    }

    public static GateResult of(List<String> problems) {
        List<String> safe = problems == null ? List.of() : problems;
        return new GateResult(safe.isEmpty(), safe);
    }

    public static GateResult passed() {
        return new GateResult(true, List.of());
    }
}
