package com.collabrouter.common;

import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Maps envelopes to and from the flat JSON object used on the wire:
 * {@code {type, username, content, time, user_list, is_system, to, from, documentID,
 * documents, document, name, language, color, token}}. Which fields are present depends
 * on the type.
 */
public final class EnvelopeCodec {

    private static final Gson GSON = new Gson();

    private EnvelopeCodec() {
    }

    public static String toJson(Envelope envelope) {
        return GSON.toJson(encode(envelope));
    }

    public static Envelope fromJson(String json) throws ProtocolException {
        JsonElement root;
        try {
            root = GSON.fromJson(json, JsonElement.class);
        } catch (JsonParseException e) {
            throw new ProtocolException("Malformed JSON frame: " + e.getMessage(), e);
        }
        if (root == null || !root.isJsonObject()) {
            throw new ProtocolException("Frame is not a JSON object");
        }
        return decode(root.getAsJsonObject());
    }

    public static JsonObject encode(Envelope envelope) {
        JsonObject root = new JsonObject();
        root.addProperty("type", envelope.getType().getTag());
        switch (envelope.getType()) {
            case PUBLIC -> {
                Envelope.Broadcast b = (Envelope.Broadcast) envelope;
                root.addProperty("username", b.getSender());
                root.addProperty("content", b.getBody());
                putTime(root, b.getTime());
                root.add("user_list", names(b.getUserList()));
                root.addProperty("is_system", false);
            }
            case PRIVATE -> {
                Envelope.Private p = (Envelope.Private) envelope;
                root.addProperty("username", p.getFrom());
                root.addProperty("from", p.getFrom());
                root.addProperty("to", p.getTo());
                root.addProperty("content", p.getBody());
                putTime(root, p.getTime());
            }
            case SYSTEM -> {
                Envelope.SystemNotice s = (Envelope.SystemNotice) envelope;
                root.addProperty("username", Envelope.SystemNotice.SENDER);
                root.addProperty("content", s.getBody());
                putTime(root, s.getTime());
                root.add("user_list", names(s.getUserList()));
                root.addProperty("is_system", true);
            }
            case DOC_LIST -> {
                JsonArray docs = new JsonArray();
                for (DocumentSummary summary : ((Envelope.DocumentList) envelope).getDocuments()) {
                    docs.add(encodeSummary(summary));
                }
                root.add("documents", docs);
            }
            case DOC_OPEN -> root.addProperty("documentID", ((Envelope.DocumentOpen) envelope).getDocumentId());
            case DOC_CREATE -> {
                Envelope.DocumentCreate c = (Envelope.DocumentCreate) envelope;
                root.addProperty("name", c.getName());
                root.addProperty("language", c.getLanguage());
            }
            case DOC_CONTENT -> {
                Document doc = ((Envelope.DocumentContent) envelope).getDocument();
                root.addProperty("documentID", doc.getId());
                root.addProperty("name", doc.getName());
                root.addProperty("content", doc.getContent());
                root.addProperty("language", doc.getLanguage());
                root.add("document", encodeDocument(doc));
            }
            case DOC_UPDATE -> {
                Envelope.DocumentEdit e = (Envelope.DocumentEdit) envelope;
                root.addProperty("documentID", e.getDocumentId());
                root.addProperty("username", e.getSender());
                root.addProperty("content", e.getBody());
            }
            case USER_JOINED -> {
                Envelope.UserJoined j = (Envelope.UserJoined) envelope;
                root.addProperty("documentID", j.getDocumentId());
                root.addProperty("username", j.getWho());
                root.addProperty("color", j.getColor());
            }
            case USER_LEFT -> {
                Envelope.UserLeft l = (Envelope.UserLeft) envelope;
                root.addProperty("documentID", l.getDocumentId());
                root.addProperty("username", l.getWho());
            }
            case AUTH -> root.addProperty("token", ((Envelope.Hello) envelope).getToken());
            case UNAUTHORIZED -> root.addProperty("content", ((Envelope.Unauthorized) envelope).getReason());
        }
        return root;
    }

    public static Envelope decode(JsonObject root) throws ProtocolException {
        try {
            MessageType type = MessageType.fromTag(string(root, "type"));
            return switch (type) {
                case PUBLIC -> new Envelope.Broadcast(string(root, "username"), string(root, "content"),
                    time(root), stringList(root, "user_list"));
                case PRIVATE -> new Envelope.Private(
                    firstNonNull(string(root, "from"), string(root, "username")),
                    string(root, "to"), string(root, "content"), time(root));
                case SYSTEM -> new Envelope.SystemNotice(string(root, "content"), time(root),
                    stringList(root, "user_list"));
                case DOC_LIST -> new Envelope.DocumentList(summaries(root));
                case DOC_OPEN -> new Envelope.DocumentOpen(string(root, "documentID"));
                case DOC_CREATE -> new Envelope.DocumentCreate(string(root, "name"), string(root, "language"));
                case DOC_CONTENT -> new Envelope.DocumentContent(contentDocument(root));
                case DOC_UPDATE -> new Envelope.DocumentEdit(string(root, "documentID"),
                    string(root, "username"), string(root, "content"));
                case USER_JOINED -> new Envelope.UserJoined(string(root, "documentID"),
                    string(root, "username"), string(root, "color"));
                case USER_LEFT -> new Envelope.UserLeft(string(root, "documentID"), string(root, "username"));
                case AUTH -> new Envelope.Hello(string(root, "token"));
                case UNAUTHORIZED -> new Envelope.Unauthorized(string(root, "content"));
            };
        } catch (IllegalStateException | UnsupportedOperationException | ClassCastException e) {
            throw new ProtocolException("Field of unexpected shape: " + e.getMessage(), e);
        }
    }

    public static JsonObject encodeDocument(Document doc) {
        JsonObject obj = new JsonObject();
        obj.addProperty("id", doc.getId());
        obj.addProperty("name", doc.getName());
        obj.addProperty("content", doc.getContent());
        obj.addProperty("language", doc.getLanguage());
        obj.addProperty("created_by", doc.getCreatedBy());
        putInstant(obj, "created_at", doc.getCreatedAt());
        putInstant(obj, "updated_at", doc.getUpdatedAt());
        return obj;
    }

    /**
     * @throws ProtocolException if the object has no {@code id}
     */
    public static Document decodeDocument(JsonObject obj) throws ProtocolException {
        return new Document(requiredId(obj), string(obj, "name"), string(obj, "content"),
            string(obj, "language"), string(obj, "created_by"),
            instant(obj, "created_at"), instant(obj, "updated_at"));
    }

    private static JsonObject encodeSummary(DocumentSummary summary) {
        JsonObject obj = new JsonObject();
        obj.addProperty("id", summary.getId());
        obj.addProperty("name", summary.getName());
        obj.addProperty("language", summary.getLanguage());
        obj.addProperty("created_by", summary.getCreatedBy());
        putInstant(obj, "created_at", summary.getCreatedAt());
        putInstant(obj, "updated_at", summary.getUpdatedAt());
        return obj;
    }

    private static List<DocumentSummary> summaries(JsonObject root) throws ProtocolException {
        List<DocumentSummary> result = new ArrayList<>();
        if (root.has("documents") && root.get("documents").isJsonArray()) {
            for (JsonElement el : root.getAsJsonArray("documents")) {
                JsonObject obj = el.getAsJsonObject();
                result.add(new DocumentSummary(requiredId(obj), string(obj, "name"), string(obj, "language"),
                    string(obj, "created_by"), instant(obj, "created_at"), instant(obj, "updated_at")));
            }
        }
        return result;
    }

    private static Document contentDocument(JsonObject root) throws ProtocolException {
        if (root.has("document") && root.get("document").isJsonObject()) {
            return decodeDocument(root.getAsJsonObject("document"));
        }
        String id = string(root, "documentID");
        if (id == null) {
            throw new ProtocolException("doc-content frame without a document id");
        }
        return new Document(id, string(root, "name"), string(root, "content"), string(root, "language"),
            null, null, null);
    }

    private static String requiredId(JsonObject obj) throws ProtocolException {
        String id = string(obj, "id");
        if (id == null) {
            throw new ProtocolException("Document entry without an id");
        }
        return id;
    }

    private static JsonArray names(List<String> names) {
        JsonArray arr = new JsonArray();
        for (String name : names) {
            arr.add(name);
        }
        return arr;
    }

    private static List<String> stringList(JsonObject obj, String key) {
        List<String> result = new ArrayList<>();
        if (obj.has(key) && obj.get(key).isJsonArray()) {
            for (JsonElement el : obj.getAsJsonArray(key)) {
                result.add(el.getAsString());
            }
        }
        return result;
    }

    private static String string(JsonObject obj, String key) {
        JsonElement el = obj.get(key);
        if (el == null || el.isJsonNull()) {
            return null;
        }
        return el.getAsString();
    }

    private static String firstNonNull(String a, String b) {
        return a != null ? a : b;
    }

    private static void putTime(JsonObject obj, Instant time) {
        putInstant(obj, "time", time);
    }

    private static void putInstant(JsonObject obj, String key, Instant value) {
        if (value != null) {
            obj.addProperty(key, value.toString());
        }
    }

    private static Instant time(JsonObject obj) {
        return instant(obj, "time");
    }

    // Unparsable timestamps decode as absent; the server stamps its own on inbound traffic.
    private static Instant instant(JsonObject obj, String key) {
        String raw = string(obj, key);
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return Instant.parse(raw);
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
