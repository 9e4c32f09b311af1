package org.selene.habitat.model;

import java.util.Objects;

/**
 * Two zone kinds that must share a direct connection.
 *
 * @param first first zone kind.
 * @param second second zone kind.
 */
public record AdjacencyPair(ZoneKind first, ZoneKind second) {
    public static final String RULE_ID_PREFIX = "adjacency_";

    public AdjacencyPair {
        Objects.requireNonNull(first, "first");
        Objects.requireNonNull(second, "second");
    }

    public static AdjacencyPair of(ZoneKind first, ZoneKind second) {
        return new AdjacencyPair(first, second);
    }

    /**
     * Stable failed-rule id for this pair, for example {@code adjacency_Airlock_Work}.
     */
    public String ruleId() {
        return RULE_ID_PREFIX + first.label() + "_" + second.label();
    }
}
