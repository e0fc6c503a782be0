package me.golemcore.archivist.domain.model;

/**
 * Hit returned by the external semantic memory service.
 */
public record ExternalMemoryHit(String id, String content, double score) {
}
