package com.ryuqq.collections.support.mapping;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * 결과 크기를 미리 확보하는 순차 map.
 *
 * <p>입력 크기만큼 용량을 잡은 뒤 순서대로 변환하므로 중간 재할당이 없습니다.
 * {@link ParallelMapper}의 결과와 비교하는 기준 구현이기도 합니다.</p>
 *
 * @author Collections Team
 * @since 1.0.0
 */
public final class ArrayMapping {

    private ArrayMapping() {
    }

    /**
     * source의 각 원소에 transform을 적용한 List 반환.
     *
     * @param source 입력 List
     * @param transform 변환 함수
     * @param <T> 입력 타입
     * @param <R> 결과 타입
     * @return 입력과 같은 순서, 같은 크기의 결과 (수정 가능)
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public static <T, R> List<R> map(List<? extends T> source, Function<? super T, ? extends R> transform) {
        if (source == null) {
            throw new IllegalArgumentException("source cannot be null");
        }
        if (transform == null) {
            throw new IllegalArgumentException("transform cannot be null");
        }

        List<R> result = new ArrayList<>(source.size());
        for (T element : source) {
            result.add(transform.apply(element));
        }
        return result;
    }
}
