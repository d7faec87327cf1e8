package com.clickermsu.registry.snapshot;

import com.clickermsu.registry.exception.SnapshotDecodeException;
import com.clickermsu.registry.model.UserRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Converts the registry to and from its backup form: a JSON array of
 * {@code [id, username, password]} rows, in table order.
 */
@Component
public class SnapshotCodec {

    private static final int ROW_WIDTH = 3;

    private final ObjectMapper objectMapper;

    public SnapshotCodec() {
        // A blob must hold exactly one array; anything after it is corruption
        this.objectMapper = new ObjectMapper()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    public String encode(List<UserRecord> snapshot) {
        ArrayNode rows = objectMapper.createArrayNode();
        for (UserRecord record : snapshot) {
            ArrayNode row = rows.addArray();
            row.add(record.getUserId());
            row.add(record.getUsername());
            row.add(record.getPassword());
        }

        try {
            return objectMapper.writeValueAsString(rows);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode registry snapshot", e);
        }
    }

    public byte[] encodeToBytes(List<UserRecord> snapshot) {
        return encode(snapshot).getBytes(StandardCharsets.UTF_8);
    }

    public List<UserRecord> decode(String blob) {
        if (blob == null || blob.isBlank()) {
            throw new SnapshotDecodeException("Snapshot blob is empty");
        }

        try {
            return decodeRows(objectMapper.readTree(blob));
        } catch (JsonProcessingException e) {
            throw new SnapshotDecodeException("Snapshot blob is not valid JSON: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Decodes raw channel bytes. Parsing the bytes directly lets Jackson reject malformed UTF-8
     * instead of substituting replacement characters.
     */
    public List<UserRecord> decode(byte[] blob) {
        if (blob == null || blob.length == 0) {
            throw new SnapshotDecodeException("Snapshot blob is empty");
        }

        try {
            return decodeRows(objectMapper.readTree(blob));
        } catch (JsonProcessingException e) {
            throw new SnapshotDecodeException("Snapshot blob is not valid UTF-8 JSON: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new SnapshotDecodeException("Snapshot blob could not be read: " + e.getMessage(), e);
        }
    }

    private List<UserRecord> decodeRows(JsonNode root) {
        if (root == null || !root.isArray()) {
            throw new SnapshotDecodeException("Snapshot blob must be a JSON array");
        }

        List<UserRecord> records = new ArrayList<>(root.size());
        for (int i = 0; i < root.size(); i++) {
            records.add(decodeRow(root.get(i), i));
        }
        return records;
    }

    private UserRecord decodeRow(JsonNode row, int index) {
        if (!row.isArray() || row.size() != ROW_WIDTH) {
            throw new SnapshotDecodeException("Row " + index + " must be an array of [id, username, password]");
        }

        JsonNode id = row.get(0);
        JsonNode username = row.get(1);
        JsonNode password = row.get(2);

        if (!id.isIntegralNumber() || !id.canConvertToLong()) {
            throw new SnapshotDecodeException("Row " + index + " has a non-integer id");
        }
        if (!username.isTextual()) {
            throw new SnapshotDecodeException("Row " + index + " has a non-text username");
        }
        if (!password.isTextual()) {
            throw new SnapshotDecodeException("Row " + index + " has a non-text password");
        }

        return UserRecord.of(id.longValue(), username.textValue(), password.textValue());
    }
}
