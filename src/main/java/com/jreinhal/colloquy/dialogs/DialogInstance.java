package com.jreinhal.colloquy.dialogs;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One persisted frame of a dialog stack. {@code state} is private to the dialog that owns
 * the frame.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class DialogInstance {
    private String id;
    private Map<String, Object> state = new LinkedHashMap<>();
    private String version;

    public DialogInstance() {}

    public DialogInstance(String id, String version) {
        this.id = id;
        this.version = version;
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }
    public String getVersion() { return version; }
    public void setVersion(String version) { this.version = version; }

    public Map<String, Object> getState() {
        return state;
    }

    public void setState(Map<String, Object> state) {
        this.state = state == null ? new LinkedHashMap<>() : state;
    }

    @Override
    public String toString() {
        return "DialogInstance[" + id + "]";
    }
}
