package com.example.chathub.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Group membership change carried over the pub/sub bus between processes.
 */
@JsonPropertyOrder({"type", "group_id", "text", "user_email", "actor"})
public class MembershipEvent {

    public enum Change {
        ADD("add", MessageKind.SYSTEM_ADD),
        REMOVE("remove", MessageKind.SYSTEM_REMOVE);

        private final String wire;
        private final MessageKind messageKind;

        Change(String wire, MessageKind messageKind) {
            this.wire = wire;
            this.messageKind = messageKind;
        }

        public String wire() { return wire; }
        public MessageKind messageKind() { return messageKind; }

        /**
         * Accepts {@code leave} as an alias of {@code remove}; older publishers emit it.
         *
         * @return the change, or {@code null} if the value is not recognised
         */
        public static Change fromWire(String value) {
            if ("add".equals(value)) return ADD;
            if ("remove".equals(value) || "leave".equals(value)) return REMOVE;
            return null;
        }
    }

    private final Change change;
    private final long groupId;
    private final String text;
    private final String userEmail;
    private final String actor;

    public MembershipEvent(Change change, long groupId, String text, String userEmail, String actor) {
        this.change = change;
        this.groupId = groupId;
        this.text = text;
        this.userEmail = userEmail;
        this.actor = actor;
    }

    @JsonIgnore
    public Change getChange() { return change; }

    @JsonProperty("type")
    public String getType() { return change.wire(); }

    @JsonProperty("group_id")
    public long getGroupId() { return groupId; }

    public String getText() { return text; }

    @JsonProperty("user_email")
    public String getUserEmail() { return userEmail; }

    public String getActor() { return actor; }
}
