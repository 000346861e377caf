package com.marketsim.simulation;

import java.util.Arrays;

/**
 * Derives independent, reproducible sub-seeds from a master seed.
 */
public final class SeedGenerator {

    private SeedGenerator() {}

    /**
     * Seed for the {@code index}-th supply iteration. Pure function of its inputs, so a run
     * reproduces regardless of how many iterations execute concurrently.
     */
    public static long deterministicSeed(long masterSeed, int index) {
        long hash = masterSeed + 0x9e3779b97f4a7c15L * (index + 1L);

        // fmix64 finalizer spreads nearby inputs across all bits
        hash ^= (hash >>> 33);
        hash *= 0xff51afd7ed558ccdL;
        hash ^= (hash >>> 33);
        hash *= 0xc4ceb9fe1a85ec53L;
        hash ^= (hash >>> 33);

        return hash;
    }

    public static long[] deterministicSeeds(long masterSeed, int count) {
        var seeds = new long[count];
        for (int i = 0; i < count; i++) {
            seeds[i] = deterministicSeed(masterSeed, i);
        }
        return seeds;
    }

    public static boolean hasCollisions(long[] seeds) {
        var uniqueCount = Arrays.stream(seeds).distinct().count();
        return uniqueCount != seeds.length;
    }
}
