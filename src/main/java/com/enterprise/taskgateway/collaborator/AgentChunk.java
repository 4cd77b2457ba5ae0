package com.enterprise.taskgateway.collaborator;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One piece of partial agent output
 */
public class AgentChunk {

    private final long index;
    private final String content;
    private final boolean last;

    @JsonCreator
    public AgentChunk(@JsonProperty("index") long index,
                      @JsonProperty("content") String content,
                      @JsonProperty("last") boolean last) {
        this.index = index;
        this.content = content;
        this.last = last;
    }

    @JsonProperty("index")
    public long getIndex() { return index; }

    @JsonProperty("content")
    public String getContent() { return content; }

    @JsonProperty("last")
    public boolean isLast() { return last; }
}
