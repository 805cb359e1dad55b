/**
 * 순환 버퍼 패키지.
 *
 * <p>head/tail 인덱스와 모듈러 연산으로 연속된 backing store를 순환 주소 지정하는
 * 양방향 버퍼들을 제공합니다.</p>
 *
 * <p><strong>주요 구성 요소:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.collections.core.circular.CircularBuffer}: 공통 계약</li>
 *   <li>{@link com.ryuqq.collections.core.circular.AbstractCircularBuffer}: 공유 인덱싱 알고리즘</li>
 *   <li>{@link com.ryuqq.collections.core.circular.RingBuffer}: 고정 용량, 가득 차면 삽입 실패</li>
 *   <li>{@link com.ryuqq.collections.core.circular.DoubleEndedArray}: 가변 용량, 삽입은 항상 성공</li>
 * </ul>
 *
 * <p><strong>설계 원칙:</strong></p>
 * <ul>
 *   <li>한 슬롯은 항상 비워 두어 {@code head == tail}이 오직 빈 상태만 의미하도록 함</li>
 *   <li>원소 수는 인덱스에서 계산하며 별도로 저장하지 않음</li>
 *   <li>확장/크기 변경 시에만 인덱스를 0으로 정규화</li>
 *   <li>각 인스턴스가 backing store를 독점하며 {@code copy()}는 독립된 복사본을 만듦</li>
 * </ul>
 *
 * @author Collections Team
 * @since 1.0.0
 */
package com.ryuqq.collections.core.circular;
