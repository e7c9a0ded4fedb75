package org.rostilos.gitvault.security.crypto;

/**
 * Argon2id work factors. Persisted in every envelope header so that files written
 * with one setting stay readable after the defaults change.
 *
 * @param iterations  number of passes over memory
 * @param memoryKib   memory cost in KiB
 * @param parallelism number of lanes
 */
public record KdfParameters(int iterations, int memoryKib, int parallelism) {

    /** Upper bounds applied when reading a header, so a corrupted file cannot request absurd work. */
    static final int MAX_ITERATIONS = 64;
    static final int MAX_MEMORY_KIB = 4 * 1024 * 1024;
    static final int MAX_PARALLELISM = 16;

    /** How far a stored header may exceed the configured work before it is refused unread. */
    static final int HEADER_WORK_FACTOR = 4;

    public KdfParameters {
        if (iterations < 1 || iterations > MAX_ITERATIONS) {
            throw new IllegalArgumentException("KDF iterations must be between 1 and " + MAX_ITERATIONS);
        }
        if (memoryKib < 8 * parallelism || memoryKib > MAX_MEMORY_KIB) {
            throw new IllegalArgumentException("KDF memory must be between 8*parallelism KiB and " + MAX_MEMORY_KIB + " KiB");
        }
        if (parallelism < 1 || parallelism > MAX_PARALLELISM) {
            throw new IllegalArgumentException("KDF parallelism must be between 1 and " + MAX_PARALLELISM);
        }
    }

    /**
     * Whether an envelope whose header carries {@code stored} may be opened by a service
     * configured with these parameters. Work up to {@link #HEADER_WORK_FACTOR} times the
     * configured cost, or up to the defaults, is accepted; anything above is treated as damage.
     */
    public boolean admits(KdfParameters stored) {
        KdfParameters floor = defaults();
        long maxIterations = Math.max((long) iterations * HEADER_WORK_FACTOR, floor.iterations());
        long maxMemoryKib = Math.max((long) memoryKib * HEADER_WORK_FACTOR, floor.memoryKib());
        long maxParallelism = Math.max((long) parallelism * HEADER_WORK_FACTOR, floor.parallelism());
        return stored.iterations() <= maxIterations
                && stored.memoryKib() <= maxMemoryKib
                && stored.parallelism() <= maxParallelism;
    }

    /**
     * OWASP baseline for Argon2id: 19 MiB, 2 iterations, 1 lane.
     */
    public static KdfParameters defaults() {
        return new KdfParameters(2, 19 * 1024, 1);
    }

    /**
     * Cheap parameters for tests and throwaway stores.
     */
    public static KdfParameters minimal() {
        return new KdfParameters(1, 64, 1);
    }
}
