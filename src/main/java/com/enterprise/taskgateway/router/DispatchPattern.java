package com.enterprise.taskgateway.router;

import java.util.EnumSet;
import java.util.Set;

/**
 * The four ways a request can be fulfilled, with the operations each accepts
 */
public enum DispatchPattern {
    DIRECT_DATASTORE(EnumSet.of(Operation.QUERY)),
    RPC(EnumSet.of(Operation.CREATE, Operation.GET, Operation.LIST, Operation.LIST_STREAM,
                   Operation.UPDATE, Operation.DELETE)),
    QUEUE_PUBLISH(EnumSet.of(Operation.PUBLISH)),
    AGENT_INVOKE(EnumSet.of(Operation.INVOKE, Operation.STREAM));

    private final Set<Operation> operations;

    DispatchPattern(Set<Operation> operations) {
        this.operations = operations;
    }

    public boolean supports(Operation operation) {
        return operations.contains(operation);
    }

    public Set<Operation> getOperations() {
        return EnumSet.copyOf(operations);
    }
}
