package com.ledgerindexer.ingestion.handler;

import com.ledgerindexer.domain.Checkpoint;
import com.ledgerindexer.domain.CheckpointTransaction;
import com.ledgerindexer.domain.ContractEventRecord;
import com.ledgerindexer.domain.RecordKind;
import com.ledgerindexer.domain.TransactionEvent;
import com.ledgerindexer.ingestion.config.ContractProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * DataPod contract events, keyed by (transaction digest, event index). The index is the event's position among
 * all events of its transaction, so it is stable whatever the package filter.
 * Payload fields come from the feed's parsed JSON; fields the event does not carry stay null.
 */
@Component
public class ContractEventHandler implements LaneHandler<ContractEventRecord> {

    public static final String NAME = "contract_event_handler";

    private final String packageAddress;

    public ContractEventHandler(ContractProperties contractProperties) {
        this.packageAddress = contractProperties.hasPackageAddress()
                ? normalize(contractProperties.getPackageAddress())
                : null;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public RecordKind kind() {
        return RecordKind.CONTRACT_EVENT;
    }

    @Override
    public List<ContractEventRecord> extract(Checkpoint checkpoint) {
        long seq = checkpoint.sequenceNumber();
        List<ContractEventRecord> events = new ArrayList<>();
        for (CheckpointTransaction tx : checkpoint.transactions()) {
            List<TransactionEvent> txEvents = tx.events();
            for (int eventIndex = 0; eventIndex < txEvents.size(); eventIndex++) {
                TransactionEvent event = txEvents.get(eventIndex);
                if (event.type() == null || event.type().isBlank()) {
                    throw new ExtractionException(seq, "event " + eventIndex + " of " + tx.digest() + " has no type");
                }
                if (!matchesPackage(event)) {
                    continue;
                }
                if (tx.digest() == null || tx.digest().isBlank()) {
                    throw new ExtractionException(seq, "event " + eventIndex + " in transaction without digest");
                }
                events.add(toRecord(seq, checkpoint.timestampMs(), tx.digest(), eventIndex, event));
            }
        }
        return events;
    }

    private boolean matchesPackage(TransactionEvent event) {
        if (packageAddress == null) {
            return true;
        }
        String eventPackage = event.packageId() != null
                ? event.packageId()
                : event.type().substring(0, Math.max(0, event.type().indexOf("::")));
        return packageAddress.equals(normalize(eventPackage));
    }

    private static ContractEventRecord toRecord(long seq, long timestampMs, String digest, int eventIndex,
                                                TransactionEvent event) {
        Map<String, Object> fields = event.parsedJson();
        return new ContractEventRecord(
                event.shortTypeName(),
                stringOrEmpty(fields.get("datapod_id")),
                stringOrEmpty(fields.get("seller")),
                string(fields.get("title")),
                string(fields.get("category")),
                number(seq, fields, "price"),
                string(fields.get("kiosk_id")),
                number(seq, fields, "old_price"),
                number(seq, fields, "new_price"),
                digest,
                seq,
                eventIndex,
                timestampMs
        );
    }

    private static String string(Object value) {
        return value == null ? null : value.toString();
    }

    private static String stringOrEmpty(Object value) {
        return value == null ? "" : value.toString();
    }

    /**
     * Move u64 values arrive either as JSON numbers or as decimal strings.
     */
    private static Long number(long seq, Map<String, Object> fields, String key) {
        Object value = fields.get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof Number n) {
            return n.longValue();
        }
        try {
            return Long.parseLong(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new ExtractionException(seq, "field " + key + " is not a number: " + value, e);
        }
    }

    /** Lowercase with a 0x prefix, the form package ids and type tags use. */
    static String normalize(String address) {
        String a = address.trim().toLowerCase(Locale.ROOT);
        return a.startsWith("0x") ? a : "0x" + a;
    }
}
