package org.l3.morpho.cascade;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import javax.annotation.concurrent.ThreadSafe;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Analyzes many words with one cascade. Results come back in the order of the words, whether they are computed on
 * the calling thread or on an executor.
 */
@ThreadSafe
public class BatchAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(BatchAnalyzer.class);

    private final Cascade<?> cascade;
    private final int nbest;
    private final FrequencySource frequencies;

    public BatchAnalyzer(final Cascade<?> cascade) {
        this(cascade, Cascade.ALL, null);
    }

    public BatchAnalyzer(final Cascade<?> cascade, final int nbest, @Nullable final FrequencySource frequencies) {
        Ranker.checkNbest(nbest);
        this.cascade = cascade;
        this.nbest = nbest;
        this.frequencies = frequencies;
    }

    public List<List<AnalysisResult>> analyzeAll(final List<String> words) {
        List<List<AnalysisResult>> results = new ArrayList<>(words.size());
        for (String word : words) {
            results.add(cascade.analyze(word, nbest, frequencies));
        }
        return results;
    }

    /**
     * Analyze the words on an executor.
     *
     * @param words the words
     * @param executor runs one task per word; not shut down by this method
     * @return one result list per word, in the order of the words
     * @throws InterruptedException if interrupted while waiting for results; words not yet analyzed are cancelled
     */
    public List<List<AnalysisResult>> analyzeAll(final List<String> words, final ExecutorService executor)
            throws InterruptedException {
        List<Future<List<AnalysisResult>>> futures = new ArrayList<>(words.size());
        for (String word : words) {
            futures.add(executor.submit(() -> cascade.analyze(word, nbest, frequencies)));
        }
        List<List<AnalysisResult>> results = new ArrayList<>(words.size());
        try {
            for (Future<List<AnalysisResult>> future : futures) {
                results.add(future.get());
            }
        } catch (InterruptedException e) {
            cancelAll(futures);
            throw e;
        } catch (ExecutionException e) {
            cancelAll(futures);
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new IllegalStateException("Analysis failed", cause);
        }
        log.debug("Analyzed {} words with {}", words.size(), cascade.getName());
        return results;
    }

    private static void cancelAll(final List<Future<List<AnalysisResult>>> futures) {
        int cancelled = 0;
        for (Future<List<AnalysisResult>> future : futures) {
            if (future.cancel(true)) {
                cancelled++;
            }
        }
        log.debug("Cancelled {} of {} analyses", cancelled, futures.size());
    }
}
