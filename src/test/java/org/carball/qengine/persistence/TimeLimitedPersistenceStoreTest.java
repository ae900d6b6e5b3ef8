package org.carball.qengine.persistence;

import com.fasterxml.jackson.core.type.TypeReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class TimeLimitedPersistenceStoreTest {

    private static final TypeReference<List<String>> STRINGS = new TypeReference<>() { };

    private ExecutorService executor;

    @BeforeEach
    public void setUp() {
        executor = Executors.newCachedThreadPool();
    }

    @AfterEach
    public void tearDown() {
        executor.shutdownNow();
    }

    @Test
    public void shouldPassThroughFastCalls() throws IOException {
        // Given
        TimeLimitedPersistenceStore store =
                new TimeLimitedPersistenceStore(new InMemoryPersistenceStore(), 1_000, executor);

        // When
        store.save("names", List.of("a", "b"));
        Optional<List<String>> loaded = store.load("names", STRINGS);

        // Then
        assertThat(loaded).contains(List.of("a", "b"));
    }

    @Test
    public void shouldFailStalledSaveAfterTimeout() {
        // Given
        TimeLimitedPersistenceStore store = new TimeLimitedPersistenceStore(new StalledStore(), 100, executor);

        // When
        long started = System.nanoTime();

        // Then
        assertThatThrownBy(() -> store.save("names", List.of("a")))
                .isInstanceOf(IOException.class)
                .hasMessage("Persistence save of names timed out after 100 ms");
        assertThat(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started)).isLessThan(2_000);
    }

    @Test
    public void shouldFailStalledLoadAfterTimeout() {
        // Given
        TimeLimitedPersistenceStore store = new TimeLimitedPersistenceStore(new StalledStore(), 100, executor);

        // Then
        assertThatThrownBy(() -> store.load("names", STRINGS))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("timed out");
    }

    @Test
    public void shouldRethrowStoreFailuresUnchanged() {
        // Given
        PersistenceStore failing = new InMemoryPersistenceStore() {
            @Override
            public void save(String key, Object value) throws IOException {
                throw new IOException("disk full");
            }
        };
        TimeLimitedPersistenceStore store = new TimeLimitedPersistenceStore(failing, 1_000, executor);

        // Then
        assertThatThrownBy(() -> store.save("names", List.of("a")))
                .isInstanceOf(IOException.class)
                .hasMessage("disk full");
    }

    private static class StalledStore implements PersistenceStore {

        @Override
        public <T> Optional<T> load(String key, TypeReference<T> type) throws IOException {
            stall();
            return Optional.empty();
        }

        @Override
        public void save(String key, Object value) throws IOException {
            stall();
        }

        private static void stall() throws IOException {
            try {
                Thread.sleep(10_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new InterruptedIOException("stalled call cancelled");
            }
        }
    }
}
