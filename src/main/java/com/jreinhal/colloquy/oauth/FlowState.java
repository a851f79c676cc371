package com.jreinhal.colloquy.oauth;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Persisted progress of one user's sign-in in one conversation. {@code flowExpires} is epoch
 * millis, 0 when no sign-in is pending.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class FlowState {
    private boolean flowStarted;
    private long flowExpires;
    private String tokenExchangeId;

    public FlowState() {}

    public FlowState(boolean flowStarted, long flowExpires) {
        this.flowStarted = flowStarted;
        this.flowExpires = flowExpires;
    }

    public boolean isFlowStarted() { return flowStarted; }
    public void setFlowStarted(boolean flowStarted) { this.flowStarted = flowStarted; }
    public long getFlowExpires() { return flowExpires; }
    public void setFlowExpires(long flowExpires) { this.flowExpires = flowExpires; }

    /**
     * Id of the last token exchange request handled, so that a redelivered request is ignored.
     */
    public String getTokenExchangeId() { return tokenExchangeId; }
    public void setTokenExchangeId(String tokenExchangeId) { this.tokenExchangeId = tokenExchangeId; }
}
