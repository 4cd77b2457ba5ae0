package com.enterprise.taskgateway.router;

import com.enterprise.taskgateway.error.GatewayError;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Normalized response: a result or an error, plus the pattern that served it
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class GatewayResponse {

    private final String requestId;
    private final ResponseStatus status;
    private final JsonNode result;
    private final GatewayError error;
    private final DispatchPattern patternUsed;

    private GatewayResponse(String requestId, ResponseStatus status, JsonNode result,
                            GatewayError error, DispatchPattern patternUsed) {
        this.requestId = requestId;
        this.status = status;
        this.result = result;
        this.error = error;
        this.patternUsed = patternUsed;
    }

    public static GatewayResponse completed(String requestId, DispatchPattern pattern, JsonNode result) {
        return new GatewayResponse(requestId, ResponseStatus.COMPLETED, result, null, pattern);
    }

    public static GatewayResponse accepted(String requestId, DispatchPattern pattern, JsonNode acknowledgment) {
        return new GatewayResponse(requestId, ResponseStatus.ACCEPTED, acknowledgment, null, pattern);
    }

    /**
     * @param pattern null when the request could not be classified
     */
    public static GatewayResponse failed(String requestId, DispatchPattern pattern, GatewayError error) {
        return new GatewayResponse(requestId, ResponseStatus.FAILED, null, error, pattern);
    }

    @JsonProperty("request_id")
    public String getRequestId() { return requestId; }

    @JsonProperty("status")
    public ResponseStatus getStatus() { return status; }

    @JsonProperty("result")
    public JsonNode getResult() { return result; }

    @JsonProperty("error")
    public GatewayError getError() { return error; }

    @JsonProperty("pattern_used")
    public DispatchPattern getPatternUsed() { return patternUsed; }

    public boolean isSuccess() {
        return status != ResponseStatus.FAILED;
    }

    @Override
    public String toString() {
        return "GatewayResponse{id=" + requestId + ", status=" + status + ", pattern=" + patternUsed
            + (error != null ? ", error=" + error : "") + "}";
    }
}
