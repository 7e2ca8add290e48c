package com.business.deduplication.bulk;

import com.business.deduplication.core.model.Address;
import com.business.deduplication.core.model.BusinessRecord;
import com.business.deduplication.store.InMemoryRecordStore;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Loads business records from JSON into an {@link InMemoryRecordStore}.
 *
 * <p>Accepts either a JSON array of record objects or JSON Lines (one object per line):</p>
 * <pre>
 * {"id": "b-1", "name": "Acme Plumbing Ltd", "phone": "416-555-0100"}
 * {"id": "b-2", "name": "Acme Plumbing", "address": {"city": "Toronto", "postalCode": "M5V 3A8"}}
 * </pre>
 *
 * <p>Records that fail to parse or lack an id or name are reported in
 * {@link ImportResult#errors()} and the import continues.</p>
 */
public class JsonRecordImporter {
    private static final Logger log = LoggerFactory.getLogger(JsonRecordImporter.class);
    private static final int PROGRESS_INTERVAL = 100;

    private final ObjectMapper mapper;
    private final InMemoryRecordStore store;

    public JsonRecordImporter(InMemoryRecordStore store) {
        this(store, new ObjectMapper());
    }

    public JsonRecordImporter(InMemoryRecordStore store, ObjectMapper mapper) {
        this.store = Objects.requireNonNull(store, "store is required");
        this.mapper = Objects.requireNonNull(mapper, "mapper is required");
    }

    public ImportResult importRecords(InputStream input, ProgressCallback callback) {
        return importRecords(new InputStreamReader(input, StandardCharsets.UTF_8), callback);
    }

    public ImportResult importRecords(Reader reader, ProgressCallback callback) {
        ProgressCallback cb = callback != null ? callback : ProgressCallback.NOOP;
        Counters counters = new Counters();

        try (BufferedReader br = reader instanceof BufferedReader b ? b : new BufferedReader(reader)) {
            if (startsWithArray(br)) {
                readArray(br, counters, cb);
            } else {
                readLines(br, counters, cb);
            }
        } catch (IOException e) {
            log.error("import.failed error={}", e.getMessage());
            counters.errors.add(new ImportResult.ImportError(0, null, "IO error: " + e.getMessage()));
        }

        ImportResult result = new ImportResult(counters.total, counters.imported, counters.replaced, counters.errors);
        cb.onProgress(counters.total, counters.total, "Import completed");
        log.info("import.completed result={}", result);
        return result;
    }

    /**
     * Maps one JSON object to a record.
     *
     * @throws IllegalArgumentException if the node is not an object, has no id or name,
     *                                  or carries a value of the wrong type
     */
    public BusinessRecord toRecord(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new IllegalArgumentException("record must be a JSON object");
        }
        BusinessRecord.Builder builder = BusinessRecord.builder()
                .id(text(node, "id"))
                .name(text(node, "name"))
                .businessType(text(node, "businessType") != null ? text(node, "businessType") : text(node, "type"))
                .businessNumber(text(node, "businessNumber"))
                .phone(text(node, "phone"))
                .email(text(node, "email"))
                .website(text(node, "website"))
                .description(text(node, "description"));

        JsonNode address = node.get("address");
        if (address != null && address.isObject()) {
            builder.address(Address.of(text(address, "street"), text(address, "city"),
                    text(address, "province"), text(address, "postalCode")));
        } else if (address != null && address.isTextual()) {
            builder.address(Address.of(address.asText(), null, null, null));
        }

        JsonNode industry = node.get("industry");
        if (industry != null && industry.isArray()) {
            List<String> tags = new ArrayList<>();
            industry.forEach(tag -> tags.add(tag.asText()));
            builder.industry(tags);
        } else if (industry != null && industry.isTextual()) {
            builder.industry(industry.asText());
        }

        JsonNode confidence = node.get("confidence");
        if (confidence != null && !confidence.isNull()) {
            if (!confidence.isNumber()) {
                throw new IllegalArgumentException("confidence must be a number");
            }
            builder.confidence(confidence.asDouble());
        }
        JsonNode verified = node.get("verified");
        if (verified != null && !verified.isNull()) {
            builder.verified(verified.asBoolean());
        }

        BusinessRecord record = builder.build();
        if (!record.hasId()) {
            throw new IllegalArgumentException("record has no id");
        }
        if (record.getName() == null) {
            throw new IllegalArgumentException("record " + record.getId() + " has no name");
        }
        return record;
    }

    private void readArray(BufferedReader br, Counters counters, ProgressCallback cb) throws IOException {
        try (JsonParser parser = mapper.getFactory().createParser(br)) {
            parser.nextToken();
            JsonToken token;
            while ((token = parser.nextToken()) != null && token != JsonToken.END_ARRAY) {
                long line = parser.currentLocation().getLineNr();
                JsonNode node = mapper.readTree(parser);
                accept(node, line, counters, cb);
            }
        } catch (JsonProcessingException e) {
            long line = e.getLocation() != null ? e.getLocation().getLineNr() : 0;
            log.warn("import.malformed line={} error={}", line, e.getOriginalMessage());
            counters.errors.add(new ImportResult.ImportError(line, null, "Malformed JSON: " + e.getOriginalMessage()));
        }
    }

    private void readLines(BufferedReader br, Counters counters, ProgressCallback cb) throws IOException {
        String line;
        long lineNumber = 0;
        while ((line = br.readLine()) != null) {
            lineNumber++;
            line = line.trim();
            if (line.isEmpty()) {
                continue;
            }
            JsonNode node;
            try {
                node = mapper.readTree(line);
            } catch (JsonProcessingException e) {
                counters.total++;
                log.warn("import.malformed line={} error={}", lineNumber, e.getOriginalMessage());
                counters.errors.add(new ImportResult.ImportError(lineNumber, null,
                        "Malformed JSON: " + e.getOriginalMessage()));
                continue;
            }
            accept(node, lineNumber, counters, cb);
        }
    }

    private void accept(JsonNode node, long line, Counters counters, ProgressCallback cb) {
        counters.total++;
        try {
            BusinessRecord record = toRecord(node);
            if (store.save(record)) {
                counters.replaced++;
            }
            counters.imported++;
        } catch (IllegalArgumentException e) {
            String id = node != null && node.hasNonNull("id") ? node.get("id").asText() : null;
            counters.errors.add(new ImportResult.ImportError(line, id, e.getMessage()));
            log.warn("import.error line={} recordId={} error={}", line, id, e.getMessage());
        }
        if (counters.total % PROGRESS_INTERVAL == 0) {
            cb.onProgress(counters.total, -1, "Processed " + counters.total + " records");
        }
    }

    private static boolean startsWithArray(BufferedReader br) throws IOException {
        while (true) {
            br.mark(1);
            int c = br.read();
            if (c < 0) {
                return false;
            }
            if (!Character.isWhitespace(c)) {
                br.reset();
                return c == '[';
            }
        }
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isValueNode()) {
            throw new IllegalArgumentException(field + " must be a scalar value");
        }
        return value.asText();
    }

    private static final class Counters {
        long total;
        long imported;
        long replaced;
        final List<ImportResult.ImportError> errors = new ArrayList<>();
    }
}
