/* (C)2026 */
package com.ammann.attention.service;

/**
 * Portion of one activity span that falls inside a query window.
 *
 * @param overlapStartMs start of the overlap in epoch milliseconds
 * @param overlapEndMs   end of the overlap in epoch milliseconds
 * @param activeSeconds  active seconds scaled by overlap / span duration
 * @param idleSeconds    idle seconds scaled by overlap / span duration
 */
public record ClippedContribution(
        long overlapStartMs, long overlapEndMs, double activeSeconds, double idleSeconds) {

    public long durationMs() {
        return overlapEndMs - overlapStartMs;
    }
}
