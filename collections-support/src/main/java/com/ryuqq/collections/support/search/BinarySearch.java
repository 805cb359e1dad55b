package com.ryuqq.collections.support.search;

import java.util.Comparator;
import java.util.List;
import java.util.OptionalInt;

/**
 * 정렬된 List에 대한 이진 탐색.
 *
 * <p>반열린 구간 {@code [low, high)}을 사용하며 중간값은
 * {@code low + (high - low) / 2}로 계산해 overflow를 피합니다.</p>
 *
 * <p>찾지 못한 경우 예외 대신 {@link OptionalInt#empty()}를 반환합니다.
 * 같은 key가 여러 개면 그중 어느 인덱스든 반환될 수 있습니다.</p>
 *
 * @author Collections Team
 * @since 1.0.0
 */
public final class BinarySearch {

    private BinarySearch() {
    }

    /**
     * Comparator 기준으로 key의 인덱스 탐색.
     *
     * @param sorted comparator 기준 오름차순 정렬된 List (RandomAccess 권장)
     * @param key 찾을 값
     * @param comparator 정렬 기준
     * @param <T> 원소 타입
     * @return key의 인덱스, 없으면 empty
     * @throws IllegalArgumentException sorted 또는 comparator가 null인 경우
     */
    public static <T> OptionalInt search(List<? extends T> sorted, T key, Comparator<? super T> comparator) {
        if (sorted == null) {
            throw new IllegalArgumentException("sorted cannot be null");
        }
        if (comparator == null) {
            throw new IllegalArgumentException("comparator cannot be null");
        }

        int low = 0;
        int high = sorted.size();
        while (low < high) {
            int mid = low + (high - low) / 2;
            int order = comparator.compare(sorted.get(mid), key);
            if (order == 0) {
                return OptionalInt.of(mid);
            }
            if (order < 0) {
                low = mid + 1;
            } else {
                high = mid;
            }
        }
        return OptionalInt.empty();
    }

    /**
     * 자연 순서 기준으로 key의 인덱스 탐색.
     *
     * @param sorted 오름차순 정렬된 List
     * @param key 찾을 값
     * @param <T> 원소 타입
     * @return key의 인덱스, 없으면 empty
     */
    public static <T extends Comparable<? super T>> OptionalInt search(List<? extends T> sorted, T key) {
        return search(sorted, key, Comparator.naturalOrder());
    }
}
