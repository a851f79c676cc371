package com.jreinhal.colloquy.oauth;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.jreinhal.colloquy.activity.Activity;

/**
 * Persisted progress of one auth handler for one user.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class SignInHandlerState {

    public enum Status {
        @JsonProperty("begin") BEGIN,
        @JsonProperty("continue") CONTINUE,
        @JsonProperty("success") SUCCESS,
        @JsonProperty("failure") FAILURE
    }

    private String id;
    private Status status;
    private FlowState state;
    private Activity continuationActivity;

    public SignInHandlerState() {}

    public SignInHandlerState(String id, Status status) {
        this.id = id;
        this.status = status;
    }

    public SignInHandlerState(SignInHandlerState other, Status status) {
        this.id = other.id;
        this.status = status;
        this.state = other.state;
        this.continuationActivity = other.continuationActivity;
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }
    public Status getStatus() { return status; }
    public void setStatus(Status status) { this.status = status; }
    public FlowState getState() { return state; }
    public void setState(FlowState state) { this.state = state; }

    /**
     * The activity that started the sign-in, used to check the reply arrives in the same conversation.
     */
    public Activity getContinuationActivity() { return continuationActivity; }
    public void setContinuationActivity(Activity continuationActivity) { this.continuationActivity = continuationActivity; }
}
