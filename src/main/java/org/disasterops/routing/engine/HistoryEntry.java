package org.disasterops.routing.engine;

import java.time.Instant;

/**
 * One recorded condition or traffic change of a segment.
 */
public record HistoryEntry<T>(Instant recordedAt, T value) {
}
