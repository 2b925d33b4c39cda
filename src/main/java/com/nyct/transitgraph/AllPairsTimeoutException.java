package com.nyct.transitgraph;

import java.time.Duration;

/**
 * The all-pairs deadline passed. Raised between per-source runs, never in the middle of one.
 */
public class AllPairsTimeoutException extends RuntimeException {
    public AllPairsTimeoutException(Duration timeout, int sourcesDone, int sourcesTotal) {
        super(String.format("All-pairs sweep exceeded %s after %d of %d sources", timeout, sourcesDone, sourcesTotal));
    }
}
