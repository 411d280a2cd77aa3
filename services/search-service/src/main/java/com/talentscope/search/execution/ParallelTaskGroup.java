package com.talentscope.search.execution;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Runs a fixed set of tasks on the search executor and waits for all of them.
 *
 * <p>The group fails as a whole: the first task failure interrupts the tasks still running and
 * is rethrown, and an expired deadline interrupts everything and raises
 * {@link SearchTimeoutException}. Results are returned in task order.
 */
public class ParallelTaskGroup {
    private final ExecutorService executor;

    public ParallelTaskGroup(ExecutorService executor) {
        this.executor = executor;
    }

    public <T> List<T> invokeAll(String stage, List<Callable<T>> tasks, SearchDeadline deadline) {
        if (tasks.isEmpty()) {
            return List.of();
        }
        deadline.ensureRemaining(stage);

        CompletionService<T> completion = new ExecutorCompletionService<>(executor);
        List<Future<T>> futures = new ArrayList<>(tasks.size());
        try {
            for (Callable<T> task : tasks) {
                futures.add(completion.submit(task));
            }
            for (int done = 0; done < futures.size(); done++) {
                Future<T> finished = completion.poll(deadline.remainingMs(), TimeUnit.MILLISECONDS);
                if (finished == null) {
                    throw new SearchTimeoutException(stage);
                }
                finished.get();
            }
            List<T> results = new ArrayList<>(futures.size());
            for (Future<T> future : futures) {
                results.add(future.get());
            }
            return results;
        } catch (ExecutionException e) {
            throw propagate(stage, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SearchExecutionException(stage + " interrupted", e);
        } finally {
            for (Future<T> future : futures) {
                if (!future.isDone()) {
                    future.cancel(true);
                }
            }
        }
    }

    private static RuntimeException propagate(String stage, ExecutionException error) {
        Throwable cause = error.getCause() == null ? error : error.getCause();
        if (cause instanceof RuntimeException runtime) {
            return runtime;
        }
        return new SearchExecutionException(stage + " failed", cause);
    }
}
