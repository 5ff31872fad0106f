package com.assetvault.upload.gateway;

public sealed interface PlanDecision {

    record Allowed() implements PlanDecision {
    }

    record LimitExceeded(long limitBytes) implements PlanDecision {
    }

    static PlanDecision allowed() {
        return new Allowed();
    }

    static PlanDecision limitExceeded(long limitBytes) {
        return new LimitExceeded(limitBytes);
    }
}
