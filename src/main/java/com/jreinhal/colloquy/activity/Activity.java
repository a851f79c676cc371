package com.jreinhal.colloquy.activity;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * One inbound or outbound conversational record. Inbound activities are parsed and
 * validated by the transport before they reach the dialog engine.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class Activity {

    private String type;
    private String id;
    private String name;
    private String channelId;
    private String text;
    private String locale;
    private Object value;
    private ChannelAccount from;
    private ChannelAccount recipient;
    private ConversationAccount conversation;
    private ConversationReference relatesTo;
    private String replyToId;
    private String inputHint;
    private String serviceUrl;
    private List<Attachment> attachments;

    public Activity() {}

    public Activity(String type) {
        this.type = type;
    }

    public static Activity message(String text) {
        Activity activity = new Activity(ActivityTypes.MESSAGE);
        activity.setText(text);
        return activity;
    }

    public static Activity message(String text, String inputHint) {
        Activity activity = message(text);
        activity.setInputHint(inputHint);
        return activity;
    }

    public static Activity attachment(Attachment attachment) {
        Activity activity = new Activity(ActivityTypes.MESSAGE);
        activity.getAttachments().add(attachment);
        return activity;
    }

    public static Activity invokeResponse(int status, Object body) {
        Activity activity = new Activity(ActivityTypes.INVOKE_RESPONSE);
        activity.setValue(new InvokeResponse(status, body));
        return activity;
    }

    /**
     * Field-by-field copy with its own attachment list. Sending stamps addressing onto the
     * sent activity, so stored activities are copied before they are sent.
     */
    public Activity copy() {
        Activity copy = new Activity(this.type);
        copy.id = this.id;
        copy.name = this.name;
        copy.channelId = this.channelId;
        copy.text = this.text;
        copy.locale = this.locale;
        copy.value = this.value;
        copy.from = this.from;
        copy.recipient = this.recipient;
        copy.conversation = this.conversation;
        copy.relatesTo = this.relatesTo;
        copy.replyToId = this.replyToId;
        copy.inputHint = this.inputHint;
        copy.serviceUrl = this.serviceUrl;
        if (this.attachments != null) {
            copy.attachments = new ArrayList<>(this.attachments);
        }
        return copy;
    }

    @JsonIgnore
    public boolean isType(String activityType) {
        return activityType != null && activityType.equalsIgnoreCase(this.type);
    }

    @JsonIgnore
    public ConversationReference getConversationReference() {
        return new ConversationReference(this.id, this.from, this.recipient, this.conversation,
                this.channelId, this.locale, this.serviceUrl);
    }

    /**
     * Reads {@code value} as a JSON-style object. Transports deliver structured values as maps.
     */
    @JsonIgnore
    @SuppressWarnings("unchecked")
    public Map<String, Object> getValueAsMap() {
        return this.value instanceof Map<?, ?> map ? (Map<String, Object>) map : null;
    }

    public String getType() { return type; }
    public void setType(String type) { this.type = type; }
    public String getId() { return id; }
    public void setId(String id) { this.id = id; }
    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public String getChannelId() { return channelId; }
    public void setChannelId(String channelId) { this.channelId = channelId; }
    public String getText() { return text; }
    public void setText(String text) { this.text = text; }
    public String getLocale() { return locale; }
    public void setLocale(String locale) { this.locale = locale; }
    public Object getValue() { return value; }
    public void setValue(Object value) { this.value = value; }
    public ChannelAccount getFrom() { return from; }
    public void setFrom(ChannelAccount from) { this.from = from; }
    public ChannelAccount getRecipient() { return recipient; }
    public void setRecipient(ChannelAccount recipient) { this.recipient = recipient; }
    public ConversationAccount getConversation() { return conversation; }
    public void setConversation(ConversationAccount conversation) { this.conversation = conversation; }
    public ConversationReference getRelatesTo() { return relatesTo; }
    public void setRelatesTo(ConversationReference relatesTo) { this.relatesTo = relatesTo; }
    public String getReplyToId() { return replyToId; }
    public void setReplyToId(String replyToId) { this.replyToId = replyToId; }
    public String getInputHint() { return inputHint; }
    public void setInputHint(String inputHint) { this.inputHint = inputHint; }
    public String getServiceUrl() { return serviceUrl; }
    public void setServiceUrl(String serviceUrl) { this.serviceUrl = serviceUrl; }

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public List<Attachment> getAttachments() {
        if (this.attachments == null) {
            this.attachments = new ArrayList<>();
        }
        return attachments;
    }

    public void setAttachments(List<Attachment> attachments) { this.attachments = attachments; }
}
