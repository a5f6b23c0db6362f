package at.sv.astro;

import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Runs at most one computation at a time for one logical stream of results and holds the latest published result.
 * <p>
 * Submitting a computation cancels the one still running. Only a computation that completes without being cancelled
 * publishes its result; the publish re-checks the cancellation under the stream lock, so a superseded computation can
 * never overwrite the result of a newer one. Failures other than cancellation are logged and leave the published
 * result untouched.
 */
@Slf4j
public final class ComputationStream<T> implements AutoCloseable {

    private final String name;
    private final ExecutorService executor;
    private final AtomicReference<T> published;
    private final AtomicBoolean loading;
    private final AtomicLong version;
    private final List<Consumer<? super T>> subscribers;
    private final Object lock = new Object();
    private final Object notifyLock = new Object();
    private Job current;

    public ComputationStream(String name, T initialValue) {
        this(name, Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "stream-" + name);
            thread.setDaemon(true);
            return thread;
        }), initialValue);
    }

    /**
     * @param executor has to run at most one task at a time, otherwise a superseded computation may still run in
     *                 parallel to its successor
     */
    public ComputationStream(String name, ExecutorService executor, T initialValue) {
        this.name = name;
        this.executor = executor;
        published = new AtomicReference<>(initialValue);
        loading = new AtomicBoolean();
        version = new AtomicLong();
        subscribers = new CopyOnWriteArrayList<>();
    }

    /**
     * Cancels the running computation and schedules the given one.
     *
     * @return the future of the scheduled computation. Completes exceptionally with a {@link CancellationException}
     * if superseded.
     */
    public Future<?> submit(String description, Computation<T> computation) {
        synchronized (lock) {
            cancelCurrent();
            Job job = new Job(description);
            current = job;
            loading.set(true);
            try {
                job.future = executor.submit(() -> run(job, computation));
            } catch (RejectedExecutionException e) {
                current = null;
                loading.set(false);
                throw e;
            }
            return job.future;
        }
    }

    private void run(Job job, Computation<T> computation) {
        MDC.put("context", name);
        try {
            job.token.ensureActive();
            log.debug("Computing {}", job.description);
            T result = computation.compute(job.token);
            publish(job, result);
        } catch (CancellationException e) {
            log.debug("Cancelled {}", job.description);
            throw e;
        } catch (Exception e) {
            log.warn("Failed to compute {}: {}", job.description, e.getLocalizedMessage(), e);
        } finally {
            finish(job);
            MDC.remove("context");
        }
    }

    private void publish(Job job, T result) {
        long publishedVersion;
        synchronized (lock) {
            job.token.ensureActive();
            published.set(result);
            publishedVersion = version.incrementAndGet();
        }
        log.debug("Published {}", job.description);
        notifySubscribers(result, publishedVersion);
    }

    private void finish(Job job) {
        synchronized (lock) {
            if (current == job) {
                current = null;
                loading.set(false);
            }
        }
    }

    /**
     * Cancels any running computation and publishes the given value in its place.
     */
    public void replace(T value) {
        long replacedVersion;
        synchronized (lock) {
            cancelCurrent();
            loading.set(false);
            published.set(value);
            replacedVersion = version.incrementAndGet();
        }
        notifySubscribers(value, replacedVersion);
    }

    public void cancel() {
        synchronized (lock) {
            cancelCurrent();
            loading.set(false);
        }
    }

    private void cancelCurrent() {
        if (current == null) {
            return;
        }
        log.debug("Cancelling {}", current.description);
        current.token.cancel();
        if (current.future != null) {
            current.future.cancel(false);
        }
        current = null;
    }

    /**
     * Notifications are delivered one at a time. A value that has been superseded by the time its turn comes is not
     * delivered, so the last value a subscriber sees is always the published one.
     */
    private void notifySubscribers(T value, long valueVersion) {
        synchronized (notifyLock) {
            if (version.get() != valueVersion) {
                log.trace("Skipping notification of superseded value of '{}'", name);
                return;
            }
            for (Consumer<? super T> subscriber : subscribers) {
                try {
                    subscriber.accept(value);
                } catch (Exception e) {
                    log.error("Subscriber of '{}' failed: {}", name, e.getLocalizedMessage(), e);
                }
            }
        }
    }

    /**
     * Subscribers run on the publishing thread while later notifications of this stream wait, so they should return
     * quickly and must not block on another publish of the same stream.
     */
    public void subscribe(Consumer<? super T> subscriber) {
        subscribers.add(subscriber);
    }

    public T getValue() {
        return published.get();
    }

    /**
     * @return the number of values published so far
     */
    public long getVersion() {
        return version.get();
    }

    public boolean isLoading() {
        return loading.get();
    }

    @Override
    public void close() {
        cancel();
        executor.shutdownNow();
    }

    private static final class Job {
        private final String description;
        private final CancellationToken token;
        private Future<?> future;

        private Job(String description) {
            this.description = description;
            token = CancellationToken.create();
        }
    }
}
