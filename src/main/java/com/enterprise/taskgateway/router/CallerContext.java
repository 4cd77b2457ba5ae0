package com.enterprise.taskgateway.router;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Who issued a request, as established by the layer in front of the gateway
 */
public class CallerContext {

    private static final CallerContext ANONYMOUS = new CallerContext("anonymous", Collections.emptyMap());

    private final String callerId;
    private final Map<String, String> attributes;

    public CallerContext(String callerId, Map<String, String> attributes) {
        this.callerId = callerId;
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public static CallerContext of(String callerId) {
        return new CallerContext(callerId, Collections.emptyMap());
    }

    public static CallerContext anonymous() {
        return ANONYMOUS;
    }

    public String getCallerId() { return callerId; }
    public Map<String, String> getAttributes() { return attributes; }
}
