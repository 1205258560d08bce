package com.ledgerindexer.ingestion.feed;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ledgerindexer.domain.Checkpoint;
import com.ledgerindexer.domain.CheckpointTransaction;
import com.ledgerindexer.domain.ObjectChange;
import com.ledgerindexer.domain.TransactionEvent;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Parses the JSON checkpoint layout served by local and remote feeds:
 * <pre>
 * {"sequenceNumber": 5, "timestampMs": 1700000000000,
 *  "transactions": [{"digest": "...",
 *                    "events": [{"type": "0x2::m::E", "packageId": "0x2", "sender": "0x1", "parsedJson": {}}],
 *                    "changedObjects": [{"objectId": "0x5", "version": 3, "digest": "...", "owner": "0x1",
 *                                        "objectType": "0x2::m::T", "contentType": "moveObject"}]}]}
 * </pre>
 * Only {@code sequenceNumber} is required here. Missing per-transaction fields are left null and rejected by the
 * lanes that need them.
 */
public class CheckpointJsonReader {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public CheckpointJsonReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Checkpoint read(byte[] json) throws IOException {
        return toCheckpoint(objectMapper.readTree(json));
    }

    public Checkpoint read(String json) throws IOException {
        return toCheckpoint(objectMapper.readTree(json));
    }

    /**
     * Head document: either a bare number or {"sequenceNumber": N}.
     */
    public long readHead(String json) throws IOException {
        JsonNode node = objectMapper.readTree(json);
        JsonNode value = node.isObject() ? node.get("sequenceNumber") : node;
        if (value == null || !value.canConvertToLong()) {
            throw new IOException("Head document has no sequence number: " + json);
        }
        return value.asLong();
    }

    private Checkpoint toCheckpoint(JsonNode root) throws IOException {
        JsonNode seq = root.get("sequenceNumber");
        if (seq == null || !seq.canConvertToLong()) {
            throw new IOException("Checkpoint document has no sequenceNumber");
        }
        List<CheckpointTransaction> transactions = new ArrayList<>();
        for (JsonNode tx : root.path("transactions")) {
            transactions.add(toTransaction(tx));
        }
        return new Checkpoint(seq.asLong(), root.path("timestampMs").asLong(0L), transactions);
    }

    private CheckpointTransaction toTransaction(JsonNode tx) {
        List<TransactionEvent> events = new ArrayList<>();
        for (JsonNode e : tx.path("events")) {
            Map<String, Object> parsed = e.hasNonNull("parsedJson")
                    ? objectMapper.convertValue(e.get("parsedJson"), MAP_TYPE)
                    : Map.of();
            events.add(new TransactionEvent(text(e, "type"), text(e, "packageId"), text(e, "sender"), parsed));
        }
        List<ObjectChange> objects = new ArrayList<>();
        for (JsonNode o : tx.path("changedObjects")) {
            long version = o.hasNonNull("version") && o.get("version").canConvertToLong() ? o.get("version").asLong() : -1L;
            objects.add(new ObjectChange(text(o, "objectId"), version, text(o, "digest"), text(o, "owner"),
                    text(o, "objectType"), text(o, "contentType")));
        }
        return new CheckpointTransaction(text(tx, "digest"), events, objects);
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}
