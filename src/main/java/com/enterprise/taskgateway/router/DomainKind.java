package com.enterprise.taskgateway.router;

/**
 * What a target domain is, which decides how requests to it are served
 */
public enum DomainKind {
    /** Simple read/write on a table the gateway owns; no cross-service semantics */
    OWNED_TABLE(DispatchPattern.DIRECT_DATASTORE),
    /** Typed operations owned by a domain service (tasks, vectors) */
    DOMAIN_SERVICE(DispatchPattern.RPC),
    /** Fire-and-forget notifications and long-running side effects */
    SIDE_EFFECT(DispatchPattern.QUEUE_PUBLISH),
    /** Natural-language or reasoning work delegated to an agent */
    REASONING(DispatchPattern.AGENT_INVOKE);

    private final DispatchPattern pattern;

    DomainKind(DispatchPattern pattern) {
        this.pattern = pattern;
    }

    public DispatchPattern getPattern() {
        return pattern;
    }
}
