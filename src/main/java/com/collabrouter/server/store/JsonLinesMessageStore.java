package com.collabrouter.server.store;

import com.collabrouter.common.Envelope;
import com.collabrouter.common.EnvelopeCodec;
import com.collabrouter.common.ProtocolException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;

/**
 * Message store backed by a file of one wire-format JSON envelope per line.
 */
public class JsonLinesMessageStore implements MessageStore {

    private final Path file;

    public JsonLinesMessageStore(Path file) throws StoreException {
        this.file = file;
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
        } catch (IOException e) {
            throw new StoreException("Cannot create message store directory for " + file, e);
        }
    }

    @Override
    public synchronized void persist(Envelope envelope) throws StoreException {
        String line = EnvelopeCodec.toJson(envelope) + "\n";
        try {
            Files.writeString(file, line, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            throw new StoreException("Failed to append message to " + file, e);
        }
    }

    @Override
    public synchronized List<Envelope> fetchRecent(int limit) throws StoreException {
        if (limit <= 0 || !Files.exists(file)) {
            return List.of();
        }
        List<String> lines;
        try {
            lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new StoreException("Failed to read messages from " + file, e);
        }
        List<Envelope> result = new ArrayList<>();
        for (String line : lines.subList(Math.max(0, lines.size() - limit), lines.size())) {
            if (line.isBlank()) {
                continue;
            }
            try {
                result.add(EnvelopeCodec.fromJson(line));
            } catch (ProtocolException e) {
                throw new StoreException("Corrupt message line in " + file, e);
            }
        }
        return result;
    }
}
