package org.tesis.parque;

import java.util.Objects;

/**
 * Non-fatal record that one infrastructure element could not be placed.
 */
public final class PlacementInfeasible {

    private final InfrastructureKind kind;
    private final String reason;

    public PlacementInfeasible(InfrastructureKind kind, String reason) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.reason = Objects.requireNonNull(reason, "reason");
    }

    public InfrastructureKind getKind() {
        return kind;
    }

    public String getReason() {
        return reason;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PlacementInfeasible that)) return false;
        return kind == that.kind && reason.equals(that.reason);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, reason);
    }

    @Override
    public String toString() {
        return "PlacementInfeasible{" + kind + ": " + reason + "}";
    }
}
