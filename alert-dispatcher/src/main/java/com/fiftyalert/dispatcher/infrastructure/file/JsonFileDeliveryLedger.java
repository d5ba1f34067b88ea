package com.fiftyalert.dispatcher.infrastructure.file;

import com.fiftyalert.dispatcher.domain.exceptions.LedgerCommitException;
import com.fiftyalert.dispatcher.domain.exceptions.LedgerCorruptedException;
import com.fiftyalert.dispatcher.domain.ledger.DeliveryLedger;
import com.fiftyalert.dispatcher.domain.ledger.LedgerState;
import lombok.extern.slf4j.Slf4j;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Delivery ledger kept in a JSON document of the form
 * {@code {"sent_alerts": [...], "lastUpdated": "..."}}. Other top-level fields of the document
 * (the subscriber list lives in the same file) are carried over untouched on every commit.
 *
 * <p>A commit writes a sibling temp file, forces it to disk, re-validates it and renames it over
 * the canonical file, so a reader sees either the previous or the new document, never a mix.
 */
@Slf4j
public class JsonFileDeliveryLedger implements DeliveryLedger {

    static final String SENT_ALERTS = "sent_alerts";
    static final String LAST_UPDATED = "lastUpdated";

    private static final DateTimeFormatter CORRUPT_SUFFIX =
            DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmssSSS").withZone(ZoneOffset.UTC);

    private final Path path;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final FileMover mover;

    public JsonFileDeliveryLedger(Path path, ObjectMapper objectMapper, Clock clock) {
        this(path, objectMapper, clock, FileMover.atomic());
    }

    JsonFileDeliveryLedger(Path path, ObjectMapper objectMapper, Clock clock, FileMover mover) {
        this.path = path.toAbsolutePath();
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.mover = mover;
    }

    @Override
    public LedgerState load() {
        var document = readDocument();
        if (document == null) {
            log.info("ledger.created: path={}, no previous ledger, starting empty", path);
            return LedgerState.empty();
        }
        var state = new LedgerState(sentAlerts(document), lastUpdated(document));
        log.debug("Loaded ledger {} with {} keys", path, state.size());
        return state;
    }

    @Override
    public LedgerState commit(Collection<String> newKeys) {
        Map<String, Object> document;
        try {
            document = readDocument();
        } catch (LedgerCorruptedException e) {
            throw LedgerCommitException.of(path, e);
        }
        Map<String, Object> updated = new LinkedHashMap<>();
        var keys = new LinkedHashSet<String>();
        if (document != null) {
            updated.putAll(document);
            keys.addAll(sentAlerts(document));
        }
        keys.addAll(newKeys);
        var now = clock.instant();
        updated.put(SENT_ALERTS, new ArrayList<>(keys));
        updated.put(LAST_UPDATED, now.toString());

        Path temp = null;
        try {
            Files.createDirectories(path.getParent());
            temp = Files.createTempFile(path.getParent(), path.getFileName() + ".", ".tmp");
            write(temp, objectMapper.writeValueAsBytes(updated));
            verify(temp, keys);
            mover.move(temp, path);
            verify(path, keys);
        } catch (IOException | JacksonException e) {
            throw LedgerCommitException.of(path, e);
        } finally {
            deleteTemp(temp);
        }
        log.info("ledger.committed: path={}, added={}, total={}", path, newKeys.size(), keys.size());
        return new LedgerState(keys, now);
    }

    /**
     * @return the parsed document, or null when no ledger file exists
     */
    private Map<String, Object> readDocument() {
        if (!Files.exists(path)) {
            return null;
        }
        byte[] content;
        try {
            content = Files.readAllBytes(path);
        } catch (IOException e) {
            throw LedgerCorruptedException.unreadable(path, e);
        }
        var problem = structuralProblem(content);
        if (problem != null) {
            throw LedgerCorruptedException.of(path, problem, preserveCorruptCopy());
        }
        return asDocument(parse(content));
    }

    private Object parse(byte[] content) {
        return objectMapper.readValue(content, Object.class);
    }

    /**
     * @return a description of what makes {@code content} unusable as a ledger, or null when it is sound
     */
    private String structuralProblem(byte[] content) {
        Object parsed;
        try {
            parsed = parse(content);
        } catch (JacksonException e) {
            return "not valid JSON (" + e.getMessage() + ")";
        }
        if (!(parsed instanceof Map<?, ?> document)) {
            return "top level is not a JSON object";
        }
        if (!document.containsKey(SENT_ALERTS)) {
            return "'" + SENT_ALERTS + "' is missing";
        }
        if (!(document.get(SENT_ALERTS) instanceof List<?> entries)) {
            return "'" + SENT_ALERTS + "' is not an array";
        }
        for (var entry : entries) {
            if (!(entry instanceof String)) {
                return "'" + SENT_ALERTS + "' contains a non-string entry: " + entry;
            }
        }
        return null;
    }

    private Path preserveCorruptCopy() {
        var copy = path.resolveSibling(path.getFileName() + ".corrupt-" + CORRUPT_SUFFIX.format(clock.instant()));
        try {
            Files.copy(path, copy);
            return copy;
        } catch (IOException e) {
            log.error("Could not preserve corrupt ledger {} as {}", path, copy, e);
            return null;
        }
    }

    private void verify(Path artifact, Set<String> expectedKeys) {
        byte[] content;
        try {
            content = Files.readAllBytes(artifact);
        } catch (IOException e) {
            throw LedgerCommitException.of(artifact, e);
        }
        var problem = structuralProblem(content);
        if (problem != null) {
            throw LedgerCommitException.verificationFailed(artifact, problem);
        }
        var written = sentAlerts(asDocument(parse(content)));
        if (!written.containsAll(expectedKeys)) {
            var missing = new LinkedHashSet<>(expectedKeys);
            missing.removeAll(written);
            throw LedgerCommitException.verificationFailed(artifact, "missing keys " + missing);
        }
    }

    private static void write(Path target, byte[] content) throws IOException {
        try (var channel = FileChannel.open(target, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)) {
            var buffer = ByteBuffer.wrap(content);
            while (buffer.hasRemaining()) {
                channel.write(buffer);
            }
            channel.force(true);
        }
    }

    private void deleteTemp(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("Could not remove temporary ledger file {}", temp, e);
        }
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asDocument(Object parsed) {
        return (Map<String, Object>) parsed;
    }

    private static LinkedHashSet<String> sentAlerts(Map<String, Object> document) {
        var keys = new LinkedHashSet<String>();
        for (var entry : (List<?>) document.get(SENT_ALERTS)) {
            keys.add((String) entry);
        }
        return keys;
    }

    private Instant lastUpdated(Map<String, Object> document) {
        if (!(document.get(LAST_UPDATED) instanceof String value)) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            log.debug("Ignoring unparseable {} '{}' in {}", LAST_UPDATED, value, path);
            return null;
        }
    }
}
