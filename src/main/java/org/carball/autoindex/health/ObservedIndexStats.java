package org.carball.autoindex.health;

/**
 * One raw sample from the database monitoring views.
 */
public record ObservedIndexStats(String indexName, String table, long sizeBytes, double bloatRatio, long scanCount) {
}
