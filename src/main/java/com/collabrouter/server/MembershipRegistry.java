package com.collabrouter.server;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Who is connected, and who is attached to which document.
 *
 * Not thread-safe: owned by the {@link Router} and only touched from its thread.
 * A participant is attached to at most one document at a time.
 */
class MembershipRegistry {

    // Insertion order doubles as the order of the name list sent to clients.
    private final Map<String, Participant> participants = new LinkedHashMap<>();
    private final Map<String, Set<Participant>> documents = new HashMap<>();

    /**
     * @return false if another participant already holds the name
     */
    boolean add(Participant participant) {
        return participants.putIfAbsent(participant.getName(), participant) == null;
    }

    /**
     * Removes this exact participant from the connection set. Document membership is
     * left alone; see {@link #detach(Participant)}.
     *
     * @return false if it was not registered
     */
    boolean remove(Participant participant) {
        return participants.remove(participant.getName(), participant);
    }

    boolean contains(Participant participant) {
        return participants.get(participant.getName()) == participant;
    }

    Participant find(String name) {
        return name == null ? null : participants.get(name);
    }

    List<String> names() {
        return List.copyOf(participants.keySet());
    }

    List<Participant> participants() {
        return new ArrayList<>(participants.values());
    }

    int size() {
        return participants.size();
    }

    /**
     * Attaches to {@code documentId}. The caller detaches from any previous document first.
     */
    void attach(Participant participant, String documentId) {
        documents.computeIfAbsent(documentId, id -> new LinkedHashSet<>()).add(participant);
        participant.setCurrentDocumentId(documentId);
    }

    /**
     * @return the document the participant was attached to, or null
     */
    String detach(Participant participant) {
        String documentId = participant.getCurrentDocumentId();
        if (documentId == null) {
            return null;
        }
        participant.setCurrentDocumentId(null);
        Set<Participant> members = documents.get(documentId);
        if (members != null) {
            members.remove(participant);
            if (members.isEmpty()) {
                documents.remove(documentId);
            }
        }
        return documentId;
    }

    List<Participant> members(String documentId) {
        Set<Participant> members = documents.get(documentId);
        return members == null ? List.of() : new ArrayList<>(members);
    }

    int documentCount() {
        return documents.size();
    }
}
