package com.nyct.transitgraph;

import com.google.common.base.Preconditions;
import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.apache.commons.lang3.tuple.Pair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Shortest paths for every unordered pair of distinct stations, one single-pair Dijkstra per pair. Pairs are keyed
 * {@code (i, j)} with {@code i} before {@code j} in {@link TransitNetwork#nodeIds()}; unreachable pairs are left out.
 *
 * <p>Work is split by source station. Each source's pairs are computed by one task into its own map, and the maps
 * are merged in enumeration order, so the result does not depend on the thread count.</p>
 */
public class AllPairsShortestPaths {
    private static final Logger LOG = LoggerFactory.getLogger(AllPairsShortestPaths.class);

    private static final long PROGRESS_INTERVAL = 100;

    private final WeightedNetwork weighted;
    private final DijkstraSearch dijkstra;
    private final int threads;
    private final Duration timeout;

    public AllPairsShortestPaths(WeightedNetwork weighted, int threads, Duration timeout) {
        Preconditions.checkArgument(threads > 0, "threads must be positive, was %s", threads);
        this.weighted = weighted;
        this.dijkstra = new DijkstraSearch(weighted);
        this.threads = threads;
        this.timeout = timeout;
    }

    public AllPairsShortestPaths(WeightedNetwork weighted) {
        this(weighted, 1, null);
    }

    /**
     * @throws AllPairsTimeoutException if a timeout is set and expires before every source has been processed
     */
    public ImmutableMap<Pair<String, String>, PathResult> compute() throws InterruptedException {
        final ImmutableList<String> nodes = weighted.getNetwork().nodeIds();
        final long totalPairs = (long) nodes.size() * (nodes.size() - 1) / 2;
        final Stopwatch stopwatch = Stopwatch.createStarted();
        final AtomicLong processed = new AtomicLong();
        final AtomicInteger sourcesDone = new AtomicInteger();

        final List<Callable<Map<Pair<String, String>, PathResult>>> tasks = new ArrayList<>();
        for (int i = 0; i < nodes.size(); i++) {
            final int source = i;
            tasks.add(() -> {
                checkDeadline(stopwatch, sourcesDone.get(), nodes.size());
                final Map<Pair<String, String>, PathResult> slice = pathsFrom(nodes, source);
                sourcesDone.incrementAndGet();
                logProgress(processed.addAndGet(nodes.size() - 1 - source), totalPairs, nodes.size() - 1 - source);
                return slice;
            });
        }

        final ImmutableMap.Builder<Pair<String, String>, PathResult> result = ImmutableMap.builder();
        if (threads == 1) {
            for (Callable<Map<Pair<String, String>, PathResult>> task : tasks) {
                result.putAll(callUnchecked(task));
            }
        } else {
            runParallel(tasks, result);
        }

        final ImmutableMap<Pair<String, String>, PathResult> paths = result.build();
        LOG.info("All-pairs sweep found {} connected pairs of {} in {}", paths.size(), totalPairs, stopwatch);
        return paths;
    }

    private Map<Pair<String, String>, PathResult> pathsFrom(List<String> nodes, int source) {
        final String start = nodes.get(source);
        final Map<Pair<String, String>, PathResult> slice = new LinkedHashMap<>();
        for (String end : nodes.subList(source + 1, nodes.size())) {
            final PathResult path = dijkstra.shortestPath(start, end);
            if (path.isFound()) {
                slice.put(Pair.of(start, end), path);
            }
        }
        return slice;
    }

    private void runParallel(List<Callable<Map<Pair<String, String>, PathResult>>> tasks,
                             ImmutableMap.Builder<Pair<String, String>, PathResult> result) throws InterruptedException {
        final ExecutorService executor = Executors.newFixedThreadPool(threads,
                new ThreadFactoryBuilder().setNameFormat("all-pairs-%d").setDaemon(true).build());
        try {
            final List<Future<Map<Pair<String, String>, PathResult>>> futures = new ArrayList<>();
            for (Callable<Map<Pair<String, String>, PathResult>> task : tasks) {
                futures.add(executor.submit(task));
            }
            for (Future<Map<Pair<String, String>, PathResult>> future : futures) {
                result.putAll(future.get());
            }
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw new IllegalStateException("All-pairs task failed", e.getCause());
        } finally {
            executor.shutdownNow();
        }
    }

    private void checkDeadline(Stopwatch stopwatch, int sourcesDone, int sourcesTotal) {
        if (timeout != null && stopwatch.elapsed().compareTo(timeout) >= 0) {
            throw new AllPairsTimeoutException(timeout, sourcesDone, sourcesTotal);
        }
    }

    private static void logProgress(long processed, long total, long justAdded) {
        if (LOG.isDebugEnabled() && processed / PROGRESS_INTERVAL != (processed - justAdded) / PROGRESS_INTERVAL) {
            LOG.debug("Processed {}/{} pairs", processed, total);
        }
    }

    private static <T> T callUnchecked(Callable<T> task) {
        try {
            return task.call();
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new IllegalStateException(e);
        }
    }
}
