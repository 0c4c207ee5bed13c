/*
 * Copyright Stargazer Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.stargazer.engine;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.stargazer.api.FatalFetchException;
import io.stargazer.api.SoftFetchException;
import io.stargazer.api.model.ResourceKind;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * The concurrent fetches of one topology computation, sharing a single deadline.
 * <p>An essential fetch that fails cancels every other fetch of the group and is rethrown from {@link Fetch#get()}
 * as a {@link FatalFetchException}. Any other fetch that fails or misses the deadline yields its fallback
 * and records a warning. Cancelled fetches have their worker thread interrupted.</p>
 */
final class FetchGroup {

    private static final Logger LOGGER = LoggerFactory.getLogger(FetchGroup.class);

    private final Executor executor;
    private final String namespace;
    private final long deadlineNanos;
    private final List<FetchTask<?>> tasks = new ArrayList<>();
    private final List<String> warnings = new ArrayList<>();
    private FatalFetchException firstFatal;

    FetchGroup(Executor executor, String namespace, Duration timeout) {
        this.executor = executor;
        this.namespace = namespace;
        this.deadlineNanos = System.nanoTime() + timeout.toNanos();
    }

    <T> Fetch<T> essential(ResourceKind kind, Supplier<T> reader) {
        return new Fetch<>(kind, submit(kind, reader, true), null);
    }

    <T> Fetch<T> optional(ResourceKind kind, Supplier<T> reader, @NonNull T fallback) {
        return new Fetch<>(kind, submit(kind, reader, false), fallback);
    }

    /**
     * @return the warnings recorded so far, in the order they were observed
     */
    synchronized List<String> warnings() {
        return List.copyOf(warnings);
    }

    private <T> FetchTask<T> submit(ResourceKind kind, Supplier<T> reader, boolean essential) {
        var task = new FetchTask<>(kind, reader, essential);
        synchronized (this) {
            tasks.add(task);
            if (firstFatal != null) {
                task.cancel(true);
            }
        }
        executor.execute(task);
        return task;
    }

    private synchronized void cancelAll() {
        tasks.forEach(task -> task.cancel(true));
    }

    private synchronized void fatal(FatalFetchException e) {
        if (firstFatal == null) {
            firstFatal = e;
        }
        cancelAll();
    }

    private synchronized FatalFetchException firstFatal(FatalFetchException fallback) {
        return firstFatal == null ? fallback : firstFatal;
    }

    private synchronized void warn(String warning) {
        warnings.add(warning);
    }

    /**
     * A read whose failure, when essential, cancels the rest of the group as soon as it happens.
     */
    private final class FetchTask<T> extends FutureTask<T> {

        private final ResourceKind kind;
        private final boolean essential;

        private FetchTask(ResourceKind kind, Supplier<T> reader, boolean essential) {
            super(reader::get);
            this.kind = kind;
            this.essential = essential;
        }

        @Override
        protected void setException(Throwable t) {
            super.setException(t);
            if (essential) {
                fatal(t instanceof FatalFetchException fatal ? fatal : new FatalFetchException(kind, namespace, t));
            }
        }
    }

    final class Fetch<T> {

        private final ResourceKind kind;
        private final FetchTask<T> future;
        private final T fallback;

        private Fetch(ResourceKind kind, FetchTask<T> future, T fallback) {
            this.kind = kind;
            this.future = future;
            this.fallback = fallback;
        }

        T get() {
            try {
                return future.get(Math.max(0, deadlineNanos - System.nanoTime()), TimeUnit.NANOSECONDS);
            }
            catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                var fatal = new FatalFetchException(kind, namespace, e);
                fatal(fatal);
                throw fatal;
            }
            catch (TimeoutException e) {
                future.cancel(true);
                return failed(new SoftFetchException(kind, "timed out", e));
            }
            catch (CancellationException e) {
                return failed(new SoftFetchException(kind, "cancelled", e));
            }
            catch (ExecutionException e) {
                var cause = e.getCause();
                if (cause instanceof FatalFetchException fatal) {
                    throw firstFatal(fatal);
                }
                if (cause instanceof SoftFetchException soft) {
                    return failed(soft);
                }
                return failed(new SoftFetchException(kind, String.valueOf(cause.getMessage()), cause));
            }
        }

        private T failed(SoftFetchException e) {
            if (kind.isEssential()) {
                var fatal = new FatalFetchException(kind, namespace, e);
                fatal(fatal);
                throw firstFatal(fatal);
            }
            LOGGER.atWarn()
                    .setMessage("Continuing without {} for namespace '{}': {}")
                    .addArgument(kind)
                    .addArgument(namespace)
                    .addArgument(e.getMessage())
                    .log();
            warn(e.warning());
            return fallback;
        }
    }
}
