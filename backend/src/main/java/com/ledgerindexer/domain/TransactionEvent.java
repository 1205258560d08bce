package com.ledgerindexer.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Event emitted by a transaction. {@code type} is the fully-qualified Move type ({@code package::module::Name});
 * {@code parsedJson} holds payload fields already decoded by the feed (values may be null).
 */
public record TransactionEvent(String type, String packageId, String sender, Map<String, Object> parsedJson) {

    public TransactionEvent {
        parsedJson = parsedJson == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(parsedJson));
    }

    /**
     * Short struct name of the event type, e.g. {@code DataPodPublished} for {@code 0x2::datapod::DataPodPublished}.
     */
    public String shortTypeName() {
        if (type == null) {
            return null;
        }
        int generic = type.indexOf('<');
        String base = generic >= 0 ? type.substring(0, generic) : type;
        int sep = base.lastIndexOf("::");
        return sep >= 0 ? base.substring(sep + 2) : base;
    }
}
