package com.enterprise.taskgateway.collaborator;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Final output of an agent invocation
 */
public class AgentReply {

    private final String agent;
    private final JsonNode output;

    @JsonCreator
    public AgentReply(@JsonProperty("agent") String agent, @JsonProperty("output") JsonNode output) {
        this.agent = agent;
        this.output = output;
    }

    @JsonProperty("agent")
    public String getAgent() { return agent; }

    @JsonProperty("output")
    public JsonNode getOutput() { return output; }
}
