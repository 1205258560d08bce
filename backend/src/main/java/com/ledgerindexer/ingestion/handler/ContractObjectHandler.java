package com.ledgerindexer.ingestion.handler;

import com.ledgerindexer.domain.Checkpoint;
import com.ledgerindexer.domain.CheckpointTransaction;
import com.ledgerindexer.domain.ContractObjectRecord;
import com.ledgerindexer.domain.MergePolicy;
import com.ledgerindexer.domain.ObjectChange;
import com.ledgerindexer.domain.RecordKind;
import com.ledgerindexer.ingestion.config.ContractProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Object state written by transactions. When a package address is configured only objects whose type belongs
 * to that package are kept.
 */
@Component
public class ContractObjectHandler implements LaneHandler<ContractObjectRecord> {

    public static final String NAME = "contract_object_handler";

    private final String typePrefix;
    private final MergePolicy mergePolicy;

    public ContractObjectHandler(ContractProperties contractProperties) {
        this.typePrefix = contractProperties.hasPackageAddress()
                ? ContractEventHandler.normalize(contractProperties.getPackageAddress()) + "::"
                : null;
        if (contractProperties.getObjectMergePolicy() == MergePolicy.APPEND_ONLY) {
            throw new IllegalArgumentException("Object state needs REPLACE_ON_CONFLICT or VERSIONED_MERGE");
        }
        this.mergePolicy = contractProperties.getObjectMergePolicy();
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public RecordKind kind() {
        return RecordKind.CONTRACT_OBJECT;
    }

    @Override
    public List<ContractObjectRecord> extract(Checkpoint checkpoint) {
        long seq = checkpoint.sequenceNumber();
        List<ContractObjectRecord> objects = new ArrayList<>();
        for (CheckpointTransaction tx : checkpoint.transactions()) {
            for (ObjectChange change : tx.changedObjects()) {
                if (change.objectId() == null || change.objectId().isBlank()) {
                    throw new ExtractionException(seq, "changed object without id in " + tx.digest());
                }
                if (change.version() < 0) {
                    throw new ExtractionException(seq, "object " + change.objectId() + " has no version");
                }
                if (!matchesType(change)) {
                    continue;
                }
                if (tx.digest() == null || tx.digest().isBlank()) {
                    throw new ExtractionException(seq, "changed object " + change.objectId()
                            + " in transaction without digest");
                }
                objects.add(new ContractObjectRecord(
                        change.objectId(),
                        change.objectType() == null ? "" : change.objectType(),
                        change.owner(),
                        change.version(),
                        change.digest() == null ? "" : change.digest(),
                        change.contentType(),
                        seq,
                        tx.digest(),
                        mergePolicy
                ));
            }
        }
        return objects;
    }

    private boolean matchesType(ObjectChange change) {
        return typePrefix == null
                || (change.objectType() != null && change.objectType().toLowerCase(Locale.ROOT).startsWith(typePrefix));
    }
}
