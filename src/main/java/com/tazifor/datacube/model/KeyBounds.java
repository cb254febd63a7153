package com.tazifor.datacube.model;

import java.time.Instant;

/**
 * Inclusive key range of a level. Instants are {@code null} for spatial levels.
 */
public record KeyBounds(int minCol, int minRow, int maxCol, int maxRow, Instant minInstant, Instant maxInstant) {
}
