package com.ledgerindexer.domain;

/**
 * Object written by a transaction's effects. Version is -1 when the feed did not supply one.
 */
public record ObjectChange(String objectId, long version, String digest, String owner,
                           String objectType, String contentType) {
}
