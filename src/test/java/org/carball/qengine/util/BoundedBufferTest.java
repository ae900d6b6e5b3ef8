package org.carball.qengine.util;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class BoundedBufferTest {

    private BoundedBuffer<String> buffer;

    @BeforeEach
    public void setUp() {
        buffer = new BoundedBuffer<>(3);
        buffer.add("first");
        buffer.add("second");
        buffer.add("third");
    }

    @Test
    public void shouldEvictOnlyOldestElementWhenFull() {
        // When
        Optional<String> evicted = buffer.add("fourth");

        // Then
        assertThat(evicted).contains("first");
        assertThat(buffer.size()).isEqualTo(3);
        assertThat(buffer.snapshot()).containsExactly("second", "third", "fourth");
    }

    @Test
    public void shouldKeepSizeConstantAfterRepeatedOverflow() {
        // When
        for (int i = 0; i < 10; i++) {
            buffer.add("extra-" + i);
            assertThat(buffer.size()).isEqualTo(3);
        }

        // Then
        assertThat(buffer.snapshot()).containsExactly("extra-7", "extra-8", "extra-9");
        assertThat(buffer.snapshotNewestFirst()).containsExactly("extra-9", "extra-8", "extra-7");
    }

    @Test
    public void shouldNotEvictBeforeCapacityIsReached() {
        // Given
        BoundedBuffer<String> roomy = new BoundedBuffer<>(5);

        // When
        int evicted = roomy.addAll(List.of("a", "b", "c"));

        // Then
        assertThat(evicted).isZero();
        assertThat(roomy.size()).isEqualTo(3);
    }

    @Test
    public void shouldCountEvictionsForBatchAppend() {
        // When
        int evicted = buffer.addAll(List.of("fourth", "fifth"));

        // Then
        assertThat(evicted).isEqualTo(2);
        assertThat(buffer.snapshot()).containsExactly("third", "fourth", "fifth");
    }

    @Test
    public void shouldRejectNonPositiveCapacity() {
        assertThatThrownBy(() -> new BoundedBuffer<String>(0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Buffer capacity must be positive: 0");
    }
}
