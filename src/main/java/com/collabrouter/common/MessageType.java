package com.collabrouter.common;

import java.util.HashMap;
import java.util.Map;

public enum MessageType {
    PUBLIC("public"),               // broadcast chat message
    PRIVATE("Private"),             // directed message between two participants
    SYSTEM("system"),               // server notices: joins, leaves, errors
    DOC_LIST("doc-list"),           // document listing request / response / refresh notice
    DOC_OPEN("doc-open"),           // client -> server: attach to a document
    DOC_CREATE("doc-create"),       // client -> server: create a document
    DOC_CONTENT("doc-content"),     // server -> client: full document after open or create
    DOC_UPDATE("doc-update"),       // document edit event
    USER_JOINED("user-joined"),     // someone attached to the document you are editing
    USER_LEFT("user-left"),         // someone detached from the document you are editing
    AUTH("auth"),                   // initial handshake, carries the credential token
    UNAUTHORIZED("unauthorized");   // server -> client: handshake rejected

    private static final Map<String, MessageType> BY_TAG = new HashMap<>();

    static {
        for (MessageType type : values()) {
            BY_TAG.put(type.tag, type);
        }
    }

    private final String tag;

    MessageType(String tag) {
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }

    /**
     * Resolves a wire tag. Unknown or missing tags are treated as a public broadcast.
     */
    public static MessageType fromTag(String tag) {
        if (tag == null) {
            return PUBLIC;
        }
        return BY_TAG.getOrDefault(tag, PUBLIC);
    }
}
