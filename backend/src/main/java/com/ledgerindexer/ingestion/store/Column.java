package com.ledgerindexer.ingestion.store;

/**
 * One mapped column: SQL name, JDBC type (java.sql.Types) and the type its bind parameter is cast to in MERGE.
 */
public record Column(String name, int sqlType, String castType) {
}
