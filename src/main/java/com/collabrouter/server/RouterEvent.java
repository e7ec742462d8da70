package com.collabrouter.server;

import com.collabrouter.common.Envelope;

import java.util.Objects;

/**
 * Input to the router's single queue. Everything that changes membership or needs a
 * routing decision arrives as one of these.
 */
public interface RouterEvent {

    enum Type {
        REGISTER,
        UNREGISTER,
        BROADCAST,
        PRIVATE,
        DOCUMENT_EDIT,
        ATTACH_DOCUMENT,
        DOCUMENTS_CHANGED
    }

    Type getType();

    final class Register implements RouterEvent {
        private final Participant participant;

        public Register(Participant participant) {
            this.participant = Objects.requireNonNull(participant, "participant");
        }

        @Override
        public Type getType() {
            return Type.REGISTER;
        }

        public Participant getParticipant() {
            return participant;
        }
    }

    final class Unregister implements RouterEvent {
        private final Participant participant;

        public Unregister(Participant participant) {
            this.participant = Objects.requireNonNull(participant, "participant");
        }

        @Override
        public Type getType() {
            return Type.UNREGISTER;
        }

        public Participant getParticipant() {
            return participant;
        }
    }

    final class RouteBroadcast implements RouterEvent {
        private final Envelope.Broadcast message;

        public RouteBroadcast(Envelope.Broadcast message) {
            this.message = Objects.requireNonNull(message, "message");
        }

        @Override
        public Type getType() {
            return Type.BROADCAST;
        }

        public Envelope.Broadcast getMessage() {
            return message;
        }
    }

    final class RoutePrivate implements RouterEvent {
        private final Envelope.Private message;

        public RoutePrivate(Envelope.Private message) {
            this.message = Objects.requireNonNull(message, "message");
        }

        @Override
        public Type getType() {
            return Type.PRIVATE;
        }

        public Envelope.Private getMessage() {
            return message;
        }
    }

    final class RouteDocumentEdit implements RouterEvent {
        private final Envelope.DocumentEdit edit;

        public RouteDocumentEdit(Envelope.DocumentEdit edit) {
            this.edit = Objects.requireNonNull(edit, "edit");
        }

        @Override
        public Type getType() {
            return Type.DOCUMENT_EDIT;
        }

        public Envelope.DocumentEdit getEdit() {
            return edit;
        }
    }

    final class AttachDocument implements RouterEvent {
        private final Participant participant;
        private final String documentId;

        public AttachDocument(Participant participant, String documentId) {
            this.participant = Objects.requireNonNull(participant, "participant");
            this.documentId = Objects.requireNonNull(documentId, "documentId");
        }

        @Override
        public Type getType() {
            return Type.ATTACH_DOCUMENT;
        }

        public Participant getParticipant() {
            return participant;
        }

        public String getDocumentId() {
            return documentId;
        }
    }

    final class DocumentsChanged implements RouterEvent {
        @Override
        public Type getType() {
            return Type.DOCUMENTS_CHANGED;
        }
    }
}
