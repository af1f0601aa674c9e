package de.uos.ikw.izpb.analysis;

import de.uos.ikw.izpb.lookup.GenderLookup;
import de.uos.ikw.izpb.lookup.LookupException;
import de.uos.ikw.izpb.lookup.LookupResult;
import de.uos.ikw.izpb.schemas.GenderLabel;
import de.uos.ikw.izpb.schemas.Resolution;
import de.uos.ikw.izpb.schemas.ResolutionSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static de.uos.ikw.izpb.util.AuxiliarFunctions.coalesce;

/**
 * Parallel knowledge base lookups of person names. The distinct names are split evenly across a
 * fixed number of workers; every name gets a resolution, failed lookups an UNDETERMINED one.
 */
public class PoolResolution {
    private static final Logger logger = LoggerFactory.getLogger(PoolResolution.class);

    private final GenderLookup lookup;
    private final int numWorkers;
    private final Duration budgetPerName;
    private final Duration grace;

    private class WorkerResolution implements Runnable {
        private final List<String> namesSlice;      // worker slice of the distinct names
        private final Map<String, Resolution> results;
        private final int numWorker;

        /**
         * Thread process of the resolution pool.
         * @param names     Names this worker looks up.
         * @param results   Shared map the resolutions are stored in.
         * @param numWorker Worker ID.
         */
        private WorkerResolution(List<String> names, Map<String, Resolution> results, int numWorker) {
            this.namesSlice = names;
            this.results = results;
            this.numWorker = numWorker;
        }

        @Override
        public void run() {
            for (String name : namesSlice) {
                if (Thread.currentThread().isInterrupted()) {
                    logger.warn("Worker {} interrupted before finishing its names", numWorker);
                    return;
                }
                results.put(name, resolve(name));
            }
            logger.debug("Worker {}: finished {} names", numWorker, namesSlice.size());
        }
    }

    /**
     * @param lookup      Lookup shared by all workers; must be thread-safe.
     * @param numWorkers  Size of the thread pool.
     * @param budgetPerName Time a worker may spend on one name. The pool is stopped when the
     *                      budget of its largest slice plus the grace period is used up; names not
     *                      resolved by then are UNDETERMINED.
     * @param grace         Extra time given to the pool on top of the budget.
     */
    public PoolResolution(GenderLookup lookup, int numWorkers, Duration budgetPerName, Duration grace) {
        this.lookup = lookup;
        this.numWorkers = Math.max(1, numWorkers);
        this.budgetPerName = budgetPerName;
        this.grace = grace;
    }

    public PoolResolution(GenderLookup lookup, int numWorkers, Duration budgetPerName) {
        this(lookup, numWorkers, budgetPerName, Duration.ofMinutes(1));
    }

    /**
     * Looks up a single name; lookup failures are logged and give an UNDETERMINED resolution.
     */
    public Resolution resolve(String name) {
        try {
            LookupResult result = lookup.lookup(name);
            if (result.candidates() == 0) {
                return Resolution.undetermined(ResolutionSource.NOT_RESOLVED, result.detail());
            }
            return new Resolution(result.label(), ResolutionSource.KNOWLEDGE_BASE, result.agreement(), result.detail());
        } catch (LookupException e) {
            logger.warn("Lookup failed for '{}', left undetermined: {}", name, e.getMessage());
            return Resolution.undetermined(ResolutionSource.LOOKUP_ERROR, e.getMessage());
        } catch (RuntimeException e) {
            logger.warn("Lookup failed for '{}', left undetermined", name, e);
            return Resolution.undetermined(ResolutionSource.LOOKUP_ERROR, String.valueOf(e.getMessage()));
        }
    }

    /**
     * Resolves the distinct names in parallel.
     * Workers still blocked in a lookup after the timeout may finish later; their answers are
     * discarded, the returned map is a snapshot taken when the pool was stopped.
     *
     * @return Resolution of every given name, unmodifiable.
     */
    public Map<String, Resolution> resolveAll(Collection<String> names) {
        List<String> distinct = new ArrayList<>(new LinkedHashSet<>(names));
        Map<String, Resolution> results = new ConcurrentHashMap<>();
        if (distinct.isEmpty()) {
            return Map.of();
        }
        int workers = Math.min(numWorkers, distinct.size());
        logger.info("Resolving {} distinct names with {} workers", distinct.size(), workers);

        ExecutorService executor = Executors.newFixedThreadPool(workers);
        Integer[] workersDivision = coalesce(workers, distinct.size());
        for (int i = 0; i < workers; i++) {
            List<String> namesSlice = distinct.subList(workersDivision[i], workersDivision[i + 1]);
            executor.execute(new WorkerResolution(namesSlice, results, i));
        }

        executor.shutdown();
        Duration maxDuration = budgetPerName.multipliedBy(workersDivision[1] - workersDivision[0]).plus(grace);
        try {
            if (!executor.awaitTermination(maxDuration.toMillis(), TimeUnit.MILLISECONDS)) {
                logger.warn("Name resolution did not finish within {}, stopping workers", maxDuration);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }

        Map<String, Resolution> resolved = new LinkedHashMap<>();
        int timedOut = 0;
        for (String name : distinct) {
            Resolution resolution = results.get(name);
            if (resolution == null) {
                resolution = new Resolution(GenderLabel.UNDETERMINED, ResolutionSource.LOOKUP_ERROR, 0.0, "timed out");
                timedOut++;
            }
            resolved.put(name, resolution);
        }
        if (timedOut > 0) {
            logger.warn("{} of {} names timed out, left undetermined", timedOut, distinct.size());
        }
        return Collections.unmodifiableMap(resolved);
    }
}
