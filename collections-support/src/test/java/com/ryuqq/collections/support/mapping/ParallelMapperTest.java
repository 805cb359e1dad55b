package com.ryuqq.collections.support.mapping;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CountDownLatch;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.atLeast;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * ParallelMapper 테스트.
 *
 * <p>검증 항목:</p>
 * <ul>
 *   <li>모든 설정 조합에서 순차 map과 같은 결과</li>
 *   <li>transform 실패 전파 (runtime 그대로, checked는 IllegalStateException)</li>
 *   <li>인터럽트 시 플래그 복원</li>
 *   <li>종료 후 사용 거부</li>
 * </ul>
 *
 * @author Collections Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class ParallelMapperTest {

    private static final int LARGE = 1_000_000;

    @Mock
    private Function<Integer, Integer> transform;

    private ParallelMapper mapper;

    @AfterEach
    void tearDown() {
        if (mapper != null) {
            mapper.close();
        }
    }

    // ============================================================
    // 1. 순차 map과의 동치
    // ============================================================

    @Test
    void mapRange_DefaultConfig_MatchesSequentialSquares() {
        // Given
        mapper = new ParallelMapper();

        // When
        List<Long> result = mapper.mapRange(0, LARGE, i -> (long) i * i);

        // Then
        assertThat(result).isEqualTo(sequentialSquares());
    }

    @Test
    void mapRange_ParallelismTwo_MatchesSequentialSquares() {
        // Given
        mapper = new ParallelMapper(new ParallelMapConfig().withParallelism(2));

        // When
        List<Long> result = mapper.mapRange(0, LARGE, i -> (long) i * i);

        // Then
        assertThat(result).isEqualTo(sequentialSquares());
    }

    @Test
    void mapRange_RandomSmallBlockSize_MatchesSequentialSquares() {
        // Given
        int blockSize = 2 + new Random().nextInt(9);
        mapper = new ParallelMapper(new ParallelMapConfig().withBlockSize(blockSize));

        // When
        List<Long> result = mapper.mapRange(0, LARGE, i -> (long) i * i);

        // Then
        assertThat(result).as("blockSize=%d", blockSize).isEqualTo(sequentialSquares());
    }

    @Test
    void mapRange_CombinedSettings_MatchesSequentialSquares() {
        // Given
        int blockSize = 2 + new Random().nextInt(9);
        mapper = new ParallelMapper(new ParallelMapConfig(2, blockSize));

        // When
        List<Long> result = mapper.mapRange(0, LARGE, i -> (long) i * i);

        // Then
        assertThat(result).as("blockSize=%d", blockSize).isEqualTo(sequentialSquares());
    }

    @Test
    void map_List_PreservesInputOrder() {
        // Given
        mapper = new ParallelMapper(new ParallelMapConfig(3, 7));
        List<String> words = IntStream.range(0, 1000).mapToObj(i -> "w" + i).collect(Collectors.toList());

        // When
        List<Integer> lengths = mapper.map(words, String::length);

        // Then
        assertThat(lengths).isEqualTo(ArrayMapping.map(words, String::length));
    }

    @Test
    void map_EmptyInput_ReturnsEmptyList() {
        mapper = new ParallelMapper(new ParallelMapConfig(2, 0));

        assertThat(mapper.map(List.<Integer>of(), i -> i)).isEmpty();
        assertThat(mapper.mapRange(5, 5, i -> i)).isEmpty();
    }

    @Test
    void mapRange_NonZeroStart_OffsetsIndices() {
        mapper = new ParallelMapper(new ParallelMapConfig(2, 3));

        assertThat(mapper.mapRange(10, 20, i -> i)).containsExactly(10, 11, 12, 13, 14, 15, 16, 17, 18, 19);
    }

    @Test
    void map_InvokesTransformOncePerElement() {
        // Given
        mapper = new ParallelMapper(new ParallelMapConfig(4, 5));
        when(transform.apply(anyInt())).thenAnswer(invocation -> (Integer) invocation.getArgument(0) + 1);
        List<Integer> source = IntStream.range(0, 100).boxed().collect(Collectors.toList());

        // When
        List<Integer> result = mapper.map(source, transform);

        // Then
        assertThat(result).hasSize(100).startsWith(1, 2, 3).endsWith(100);
        verify(transform, times(100)).apply(anyInt());
    }

    // ============================================================
    // 2. 실패 전파
    // ============================================================

    @Test
    void map_TransformThrowsRuntimeException_RethrownAsIs() {
        // Given
        mapper = new ParallelMapper(new ParallelMapConfig(2, 10));
        when(transform.apply(anyInt())).thenAnswer(invocation -> {
            int value = invocation.getArgument(0);
            if (value == 42) {
                throw new IllegalArgumentException("bad value: 42");
            }
            return value;
        });
        List<Integer> source = IntStream.range(0, 100).boxed().collect(Collectors.toList());

        // When & Then
        assertThatThrownBy(() -> mapper.map(source, transform))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("bad value: 42");
        verify(transform, atLeast(1)).apply(42);
    }

    @Test
    void map_TransformThrowsCheckedException_WrappedInIllegalStateException() {
        // Given
        mapper = new ParallelMapper(new ParallelMapConfig(2, 10));
        when(transform.apply(anyInt())).thenAnswer(invocation -> {
            throw new IOException("disk gone");
        });

        // When & Then
        assertThatThrownBy(() -> mapper.map(List.of(1, 2, 3), transform))
            .isInstanceOf(IllegalStateException.class)
            .hasCauseInstanceOf(IOException.class);
    }

    @Test
    void map_InterruptedWhileWaiting_RestoresFlag() {
        // Given
        mapper = new ParallelMapper(new ParallelMapConfig(2, 1));
        CountDownLatch release = new CountDownLatch(1);
        Function<Integer, Integer> blocking = value -> {
            try {
                release.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("worker interrupted", e);
            }
            return value;
        };

        // When
        Thread.currentThread().interrupt();
        try {
            assertThatThrownBy(() -> mapper.map(List.of(1, 2, 3, 4), blocking))
                .isInstanceOf(IllegalStateException.class)
                .hasCauseInstanceOf(InterruptedException.class);

            // Then
            assertThat(Thread.interrupted()).isTrue();
        } finally {
            release.countDown();
        }
    }

    // ============================================================
    // 3. 종료 / 인자 검증
    // ============================================================

    @Test
    void map_AfterClose_ThrowsException() {
        // Given
        mapper = new ParallelMapper(new ParallelMapConfig(1, 0));
        mapper.close();

        // When & Then
        assertThat(mapper.isShutdown()).isTrue();
        assertThatThrownBy(() -> mapper.map(List.of(1), i -> i))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("shut down");
    }

    @Test
    void arguments_Invalid_ThrowsException() {
        mapper = new ParallelMapper(new ParallelMapConfig(1, 0));

        assertThatThrownBy(() -> new ParallelMapper(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("config cannot be null");
        assertThatThrownBy(() -> mapper.mapRange(5, 4, i -> i))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("from must not exceed to");
        assertThatThrownBy(() -> mapper.map(null, i -> i))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void mapRange_SpanBeyondIntRange_ThrowsException() {
        // Given
        mapper = new ParallelMapper(new ParallelMapConfig(1, 0));

        // When & Then
        assertThatThrownBy(() -> mapper.mapRange(Integer.MIN_VALUE, Integer.MAX_VALUE, i -> i))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("range must not exceed")
            .hasMessageContaining("(current: 4294967295)");
        assertThatThrownBy(() -> mapper.mapRange(-1, Integer.MAX_VALUE, i -> i))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("(current: 2147483648)");
    }

    private static List<Long> sequentialSquares() {
        List<Integer> values = IntStream.range(0, LARGE).boxed().collect(Collectors.toList());
        return ArrayMapping.map(values, v -> (long) v * v);
    }
}
