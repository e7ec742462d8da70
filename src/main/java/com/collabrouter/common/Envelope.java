package com.collabrouter.common;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * The routed message unit. One final variant per wire type; {@link #getType()} is the
 * discriminant used by the codec and by the connection's inbound dispatch.
 *
 * Variants are immutable. Broadcast-class variants ({@link Broadcast} and
 * {@link SystemNotice}) carry the participant name list that was current when the
 * router enqueued them.
 */
public interface Envelope {

    MessageType getType();

    final class Broadcast implements Envelope {
        private final String sender;
        private final String body;
        private final Instant time;
        private final List<String> userList;

        public Broadcast(String sender, String body, Instant time) {
            this(sender, body, time, List.of());
        }

        public Broadcast(String sender, String body, Instant time, List<String> userList) {
            this.sender = sender;
            this.body = body == null ? "" : body;
            this.time = time;
            this.userList = List.copyOf(userList);
        }

        @Override
        public MessageType getType() {
            return MessageType.PUBLIC;
        }

        public String getSender() {
            return sender;
        }

        public String getBody() {
            return body;
        }

        public Instant getTime() {
            return time;
        }

        public List<String> getUserList() {
            return userList;
        }

        public Broadcast withUserList(List<String> names) {
            return new Broadcast(sender, body, time, names);
        }

        @Override
        public String toString() {
            return "Broadcast[" + sender + ": " + body + "]";
        }
    }

    final class Private implements Envelope {
        private final String from;
        private final String to;
        private final String body;
        private final Instant time;

        public Private(String from, String to, String body, Instant time) {
            this.from = from;
            this.to = to;
            this.body = body == null ? "" : body;
            this.time = time;
        }

        @Override
        public MessageType getType() {
            return MessageType.PRIVATE;
        }

        public String getFrom() {
            return from;
        }

        public String getTo() {
            return to;
        }

        public String getBody() {
            return body;
        }

        public Instant getTime() {
            return time;
        }

        public boolean involves(String name) {
            return Objects.equals(from, name) || Objects.equals(to, name);
        }

        @Override
        public String toString() {
            return "Private[" + from + " -> " + to + "]";
        }
    }

    final class SystemNotice implements Envelope {
        public static final String SENDER = "System";

        private final String body;
        private final Instant time;
        private final List<String> userList;

        public SystemNotice(String body, Instant time) {
            this(body, time, List.of());
        }

        public SystemNotice(String body, Instant time, List<String> userList) {
            this.body = body == null ? "" : body;
            this.time = time;
            this.userList = List.copyOf(userList);
        }

        @Override
        public MessageType getType() {
            return MessageType.SYSTEM;
        }

        public String getBody() {
            return body;
        }

        public Instant getTime() {
            return time;
        }

        public List<String> getUserList() {
            return userList;
        }

        @Override
        public String toString() {
            return "SystemNotice[" + body + "]";
        }
    }

    /**
     * Empty on the way in (a listing request) and as a refresh notice; populated in
     * the direct reply to a request.
     */
    final class DocumentList implements Envelope {
        private final List<DocumentSummary> documents;

        public DocumentList() {
            this(List.of());
        }

        public DocumentList(List<DocumentSummary> documents) {
            this.documents = List.copyOf(documents);
        }

        @Override
        public MessageType getType() {
            return MessageType.DOC_LIST;
        }

        public List<DocumentSummary> getDocuments() {
            return documents;
        }
    }

    final class DocumentOpen implements Envelope {
        private final String documentId;

        public DocumentOpen(String documentId) {
            this.documentId = documentId;
        }

        @Override
        public MessageType getType() {
            return MessageType.DOC_OPEN;
        }

        public String getDocumentId() {
            return documentId;
        }
    }

    final class DocumentCreate implements Envelope {
        private final String name;
        private final String language;

        public DocumentCreate(String name, String language) {
            this.name = name;
            this.language = language;
        }

        @Override
        public MessageType getType() {
            return MessageType.DOC_CREATE;
        }

        public String getName() {
            return name;
        }

        public String getLanguage() {
            return language;
        }
    }

    final class DocumentContent implements Envelope {
        private final Document document;

        public DocumentContent(Document document) {
            this.document = Objects.requireNonNull(document, "document");
        }

        @Override
        public MessageType getType() {
            return MessageType.DOC_CONTENT;
        }

        public Document getDocument() {
            return document;
        }
    }

    final class DocumentEdit implements Envelope {
        private final String documentId;
        private final String sender;
        private final String body;

        public DocumentEdit(String documentId, String sender, String body) {
            this.documentId = documentId;
            this.sender = sender;
            this.body = body == null ? "" : body;
        }

        @Override
        public MessageType getType() {
            return MessageType.DOC_UPDATE;
        }

        public String getDocumentId() {
            return documentId;
        }

        public String getSender() {
            return sender;
        }

        public String getBody() {
            return body;
        }

        public DocumentEdit withSender(String name) {
            return new DocumentEdit(documentId, name, body);
        }
    }

    final class UserJoined implements Envelope {
        private final String documentId;
        private final String who;
        private final String color;

        public UserJoined(String documentId, String who, String color) {
            this.documentId = documentId;
            this.who = who;
            this.color = color;
        }

        @Override
        public MessageType getType() {
            return MessageType.USER_JOINED;
        }

        public String getDocumentId() {
            return documentId;
        }

        public String getWho() {
            return who;
        }

        public String getColor() {
            return color;
        }
    }

    final class UserLeft implements Envelope {
        private final String documentId;
        private final String who;

        public UserLeft(String documentId, String who) {
            this.documentId = documentId;
            this.who = who;
        }

        @Override
        public MessageType getType() {
            return MessageType.USER_LEFT;
        }

        public String getDocumentId() {
            return documentId;
        }

        public String getWho() {
            return who;
        }
    }

    final class Hello implements Envelope {
        private final String token;

        public Hello(String token) {
            this.token = token;
        }

        @Override
        public MessageType getType() {
            return MessageType.AUTH;
        }

        public String getToken() {
            return token;
        }

        @Override
        public String toString() {
            // never log the credential
            return "Hello[***]";
        }
    }

    final class Unauthorized implements Envelope {
        private final String reason;

        public Unauthorized(String reason) {
            this.reason = reason;
        }

        @Override
        public MessageType getType() {
            return MessageType.UNAUTHORIZED;
        }

        public String getReason() {
            return reason;
        }
    }
}
