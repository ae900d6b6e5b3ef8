package org.carball.qengine.persistence;

import com.fasterxml.jackson.core.type.TypeReference;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs every call of the wrapped store on the given executor and gives up after a fixed
 * number of milliseconds. An overrun is reported as an {@link IOException}, the same as any
 * other store failure, and the stalled call is cancelled.
 */
public class TimeLimitedPersistenceStore implements PersistenceStore {

    private final PersistenceStore delegate;
    private final long timeoutMs;
    private final ExecutorService executor;

    public TimeLimitedPersistenceStore(PersistenceStore delegate, long timeoutMs, ExecutorService executor) {
        this.delegate = delegate;
        this.timeoutMs = timeoutMs;
        this.executor = executor;
    }

    @Override
    public <T> Optional<T> load(String key, TypeReference<T> type) throws IOException {
        return call("load of " + key, () -> delegate.load(key, type));
    }

    @Override
    public void save(String key, Object value) throws IOException {
        call("save of " + key, () -> {
            delegate.save(key, value);
            return null;
        });
    }

    private <T> T call(String operation, Callable<T> task) throws IOException {
        Future<T> future = executor.submit(task);
        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new IOException("Persistence " + operation + " timed out after " + timeoutMs + " ms", e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Persistence " + operation + " interrupted");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof IOException) {
                throw (IOException) cause;
            }
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new IOException("Persistence " + operation + " failed", cause);
        }
    }
}
