/**
 * 순차/병렬 map 유틸리티.
 *
 * <h2>구성 요소</h2>
 * <ul>
 *   <li>{@link com.ryuqq.collections.support.mapping.ArrayMapping} - 결과 크기를 미리 확보하는 순차 map</li>
 *   <li>{@link com.ryuqq.collections.support.mapping.ParallelMapper} - 블록 단위 병렬 map</li>
 *   <li>{@link com.ryuqq.collections.support.mapping.ParallelMapConfig} - ParallelMapper 설정</li>
 * </ul>
 *
 * <h2>보장</h2>
 * <pre>
 * parallelMapper.map(source, f).equals(ArrayMapping.map(source, f))
 *   (f가 순수 함수일 때, 모든 parallelism / blockSize 조합에서)
 * </pre>
 *
 * @author Collections Team
 * @since 1.0.0
 */
package com.ryuqq.collections.support.mapping;
