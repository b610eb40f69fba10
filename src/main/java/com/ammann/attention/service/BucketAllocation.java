/* (C)2026 */
package com.ammann.attention.service;

/**
 * Share of a {@link ClippedContribution} that lands in one fixed-width bucket.
 *
 * @param bucketIndex   index of the bucket on its grid (for hour walks: 0 is the first hour touched)
 * @param bucketStartMs bucket start in epoch milliseconds
 * @param fraction      overlap with the bucket divided by the clip duration
 * @param activeSeconds active seconds allotted to the bucket
 * @param idleSeconds   idle seconds allotted to the bucket
 */
public record BucketAllocation(
        int bucketIndex,
        long bucketStartMs,
        double fraction,
        double activeSeconds,
        double idleSeconds) {}
