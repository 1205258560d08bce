package com.ledgerindexer.ingestion.pipeline;

import com.ledgerindexer.domain.IndexedRecord;
import com.ledgerindexer.domain.RecordKind;
import com.ledgerindexer.ingestion.config.PipelineConfigurationException;
import com.ledgerindexer.ingestion.config.PipelineProperties;
import com.ledgerindexer.ingestion.handler.LaneHandler;
import com.ledgerindexer.ingestion.store.CommitSinkFactory;
import com.ledgerindexer.ingestion.store.RecordTable;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * One {@link LaneCoordinator} per enabled handler, each paired with the table of its record kind.
 * Fails at startup on lane settings for unknown lanes, duplicate lane names or kinds without a table.
 */
@Component
@Slf4j
public class LaneRegistry {

    private final List<LaneCoordinator<?>> lanes;

    public LaneRegistry(List<LaneHandler<?>> handlers, List<RecordTable<?>> tables, CommitSinkFactory commitSinkFactory,
                        PipelineProperties properties, PipelineContext context) {
        Map<RecordKind, RecordTable<?>> tablesByKind = new EnumMap<>(RecordKind.class);
        for (RecordTable<?> table : tables) {
            if (tablesByKind.put(table.kind(), table) != null) {
                throw new PipelineConfigurationException("Two tables registered for " + table.kind());
            }
        }
        Set<String> names = new HashSet<>();
        for (LaneHandler<?> handler : handlers) {
            if (!names.add(handler.name())) {
                throw new PipelineConfigurationException("Duplicate lane name " + handler.name());
            }
        }
        for (String configured : properties.getLanes().keySet()) {
            if (!names.contains(configured)) {
                throw new PipelineConfigurationException("Settings for unknown lane " + configured + "; known lanes: " + names);
            }
        }

        List<LaneCoordinator<?>> built = new ArrayList<>();
        for (LaneHandler<?> handler : handlers) {
            PipelineProperties.LaneSettings settings = properties.lane(handler.name());
            if (!settings.isEnabled()) {
                log.info("Lane {} disabled", handler.name());
                continue;
            }
            RecordTable<?> table = tablesByKind.get(handler.kind());
            if (table == null) {
                throw new PipelineConfigurationException("No table for " + handler.kind() + " (lane " + handler.name() + ")");
            }
            built.add(coordinator(handler, table, settings, commitSinkFactory, properties, context));
        }
        if (built.isEmpty()) {
            throw new PipelineConfigurationException("No lane enabled");
        }
        this.lanes = Collections.unmodifiableList(built);
    }

    @SuppressWarnings("unchecked")
    private static <R extends IndexedRecord> LaneCoordinator<R> coordinator(
            LaneHandler<R> handler, RecordTable<?> table, PipelineProperties.LaneSettings settings,
            CommitSinkFactory commitSinkFactory, PipelineProperties properties, PipelineContext context) {
        RecordTable<R> typed = (RecordTable<R>) table;
        return new LaneCoordinator<>(handler, commitSinkFactory.create(handler.name(), typed),
                commitSinkFactory.getWatermarkStore(), settings.getExtractionPolicy(), properties, context);
    }

    public List<LaneCoordinator<?>> lanes() {
        return lanes;
    }
}
