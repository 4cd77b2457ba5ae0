package com.enterprise.taskgateway.router;

import com.enterprise.taskgateway.exception.UnroutableRequestException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Registered target domains and their kinds. Classification depends on
 * nothing else, so the same request always takes the same pattern.
 */
public class RouteTable {

    private final Map<String, DomainKind> routes;

    public RouteTable(Map<String, DomainKind> routes) {
        this.routes = Collections.unmodifiableMap(new LinkedHashMap<>(routes));
    }

    /**
     * Pick the dispatch pattern for an operation on a domain
     */
    public DispatchPattern classify(String targetDomain, Operation operation) throws UnroutableRequestException {
        String operationName = operation != null ? operation.name() : "null";
        if (targetDomain == null || targetDomain.isEmpty()) {
            throw new UnroutableRequestException(String.valueOf(targetDomain), operationName, "no target domain");
        }
        DomainKind kind = routes.get(targetDomain);
        if (kind == null) {
            throw new UnroutableRequestException(targetDomain, operationName, "domain is not registered");
        }
        DispatchPattern pattern = kind.getPattern();
        if (operation == null || !pattern.supports(operation)) {
            throw new UnroutableRequestException(targetDomain, operationName,
                pattern + " accepts only " + pattern.getOperations());
        }
        return pattern;
    }

    public DomainKind kindOf(String targetDomain) {
        return routes.get(targetDomain);
    }

    public Map<String, DomainKind> getRoutes() {
        return routes;
    }
}
