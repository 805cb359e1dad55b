package com.ryuqq.collections.core.circular;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * DoubleEndedArray 단위 테스트.
 *
 * @author Collections Team
 * @since 1.0.0
 */
class DoubleEndedArrayTest {

    @Test
    void appendAndPrepend_ThenRemoveFromBothEnds_ReproducesIndices() {
        // Given
        DoubleEndedArray<Integer> array = new DoubleEndedArray<>();
        for (int i = 0; i < 1000; i++) {
            array.append(i);
            array.prepend(i);
        }

        // When & Then
        for (int i = 999; i >= 0; i--) {
            assertThat(array.removeFirst()).isEqualTo(i);
            assertThat(array.removeLast()).isEqualTo(i);
        }
        assertThat(array.isEmpty()).isTrue();

        for (int i = 0; i < 1000; i++) {
            array.append(i);
        }
        for (int i = 0; i < 1000; i++) {
            assertThat(array.get(i)).isEqualTo(i);
        }
    }

    @Test
    void append_PreservesLogicalOrder() {
        // Given
        DoubleEndedArray<String> array = new DoubleEndedArray<>();

        // When
        array.append("a");
        array.append("b");

        // Then
        assertThat(array.get(0)).isEqualTo("a");
        assertThat(array.get(1)).isEqualTo("b");
    }

    @Test
    void prepend_PreservesLogicalOrder() {
        // Given
        DoubleEndedArray<String> array = new DoubleEndedArray<>();

        // When
        array.prepend("a");
        array.prepend("b");

        // Then
        assertThat(array.get(0)).isEqualTo("b");
        assertThat(array.get(1)).isEqualTo("a");
    }

    // ============================================================
    // 확장
    // ============================================================

    @Test
    void append_NeverFails_CapacityStrictlyIncreasesOnGrowth() {
        // Given
        DoubleEndedArray<Integer> array = new DoubleEndedArray<>();
        List<Integer> capacities = new ArrayList<>();
        capacities.add(array.capacity());

        // When
        for (int i = 0; i < 10_000; i++) {
            boolean inserted = i % 2 == 0 ? array.append(i) : array.prepend(i);
            assertThat(inserted).isTrue();
            if (array.capacity() != capacities.get(capacities.size() - 1)) {
                capacities.add(array.capacity());
            }
        }

        // Then
        assertThat(array.size()).isEqualTo(10_000);
        assertThat(capacities).isSorted().doesNotHaveDuplicates();
        assertThat(capacities).startsWith(2, 4, 7, 12);
    }

    @Test
    void nextLength_UsesGoldenRatioRoundedUp() {
        assertThat(DoubleEndedArray.nextLength(2)).isEqualTo(4);
        assertThat(DoubleEndedArray.nextLength(4)).isEqualTo(7);
        assertThat(DoubleEndedArray.nextLength(7)).isEqualTo(12);
        assertThat(DoubleEndedArray.nextLength(100)).isEqualTo(162);
    }

    @Test
    void prepend_GrowthWhileHeadWrapped_KeepsOrder() {
        // Given
        DoubleEndedArray<Integer> array = new DoubleEndedArray<>();

        // When
        for (int i = 0; i < 100; i++) {
            array.prepend(i);
        }

        // Then
        List<Integer> expected = IntStream.range(0, 100).map(i -> 99 - i).boxed().collect(Collectors.toList());
        assertThat(array.toList()).isEqualTo(expected);
    }

    @Test
    void appendAll_AlwaysInsertsEverything() {
        // Given
        DoubleEndedArray<Integer> array = new DoubleEndedArray<>();
        List<Integer> values = IntStream.range(0, 1000).boxed().collect(Collectors.toList());

        // When
        int appended = array.appendAll(values);

        // Then
        assertThat(appended).isEqualTo(1000);
        int index = 0;
        for (int element : array) {
            assertThat(element).isEqualTo(index++);
        }
    }

    @Test
    void prependAll_InsertsOneByOne_ResultIsReversed() {
        // Given
        DoubleEndedArray<Integer> array = DoubleEndedArray.of(4);

        // When
        int prepended = array.prependAll(List.of(3, 2, 1));

        // Then
        assertThat(prepended).isEqualTo(3);
        assertThat(array.toList()).containsExactly(1, 2, 3, 4);
    }

    @Test
    void of_ElementsInOrder() {
        // When
        DoubleEndedArray<Integer> array = DoubleEndedArray.of(0, 1, 2, 3, 4, 5);

        // Then
        int index = 0;
        for (int element : array) {
            assertThat(element).isEqualTo(index++);
        }
        assertThat(index).isEqualTo(6);
    }

    // ============================================================
    // 용량 관리
    // ============================================================

    @Test
    void constructor_ReservingCapacityBelowTwo_ThrowsException() {
        assertThatThrownBy(() -> new DoubleEndedArray<Integer>(1))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("reservingCapacity must be at least 2");
    }

    @Test
    void reserveCapacity_GrowsButNeverShrinks() {
        // Given
        DoubleEndedArray<Integer> array = DoubleEndedArray.of(1, 2, 3);
        array.prepend(0);

        // When
        array.reserveCapacity(100);
        array.reserveCapacity(10);

        // Then
        assertThat(array.capacity()).isEqualTo(100);
        assertThat(array.toList()).containsExactly(0, 1, 2, 3);
    }

    @Test
    void clear_KeepingCapacity_RetainsBackingStore() {
        // Given
        DoubleEndedArray<Integer> array = new DoubleEndedArray<>(50);
        array.appendAll(List.of(1, 2, 3));

        // When
        array.clear(true);

        // Then
        assertThat(array.isEmpty()).isTrue();
        assertThat(array.capacity()).isEqualTo(50);
    }

    @Test
    void clear_NotKeepingCapacity_ResetsToDefault() {
        // Given
        DoubleEndedArray<Integer> array = new DoubleEndedArray<>(50);
        array.appendAll(List.of(1, 2, 3));

        // When
        array.clear(false);

        // Then
        assertThat(array.isEmpty()).isTrue();
        assertThat(array.capacity()).isEqualTo(DoubleEndedArray.DEFAULT_CAPACITY);
        assertThat(array.append(7)).isTrue();
        assertThat(array.toList()).containsExactly(7);
    }

    // ============================================================
    // 빈 배열 / 범위 / 값 의미론
    // ============================================================

    @Test
    void popAndRemove_EmptyArray() {
        DoubleEndedArray<Integer> array = new DoubleEndedArray<>();

        assertThat(array.popFirst()).isEmpty();
        assertThat(array.popLast()).isEmpty();
        assertThatThrownBy(array::removeFirst).isInstanceOf(NoSuchElementException.class);
        assertThatThrownBy(array::removeLast).isInstanceOf(NoSuchElementException.class);
    }

    @Test
    void get_OutOfRange_ThrowsException() {
        DoubleEndedArray<Integer> array = DoubleEndedArray.of(1);

        assertThatThrownBy(() -> array.get(1)).isInstanceOf(IndexOutOfBoundsException.class);
        assertThatThrownBy(() -> array.get(-1)).isInstanceOf(IndexOutOfBoundsException.class);
    }

    @Test
    void copy_IsIndependentOfSource() {
        // Given
        DoubleEndedArray<Integer> array = DoubleEndedArray.of(1, 2, 3);
        DoubleEndedArray<Integer> copy = array.copy();

        // When
        array.set(0, 100);
        copy.prepend(0);

        // Then
        assertThat(array.toList()).containsExactly(100, 2, 3);
        assertThat(copy.toList()).containsExactly(0, 1, 2, 3);
        assertThat(array).isNotEqualTo(copy);
    }

    @Test
    void stream_VisitsElementsInLogicalOrder() {
        // Given
        DoubleEndedArray<Integer> array = new DoubleEndedArray<>();
        array.append(2);
        array.prepend(1);
        array.append(3);

        // When
        int sum = array.stream().mapToInt(Integer::intValue).sum();
        List<Integer> collected = array.stream().collect(Collectors.toList());

        // Then
        assertThat(sum).isEqualTo(6);
        assertThat(collected).containsExactly(1, 2, 3);
    }
}
