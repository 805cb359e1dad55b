package com.ryuqq.collections.core.circular;

import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * 양쪽 끝에서 삽입/삭제가 가능한 순환 버퍼.
 *
 * <p>head/tail 인덱스와 모듈러 연산으로 연속된 backing store를 순환 주소 지정합니다.
 * 논리 인덱스 {@code i}는 물리 슬롯 {@code (head + i) mod backingLength}에 대응합니다.</p>
 *
 * <p><strong>구현체:</strong></p>
 * <ul>
 *   <li>{@link RingBuffer}: 고정 용량, 가득 차면 append/prepend가 {@code false} 반환</li>
 *   <li>{@link DoubleEndedArray}: 가변 용량, append/prepend는 항상 성공 (필요 시 확장)</li>
 * </ul>
 *
 * <p><strong>오류 처리 (2단계):</strong></p>
 * <ul>
 *   <li>계약 위반 (예외): 범위 밖 인덱스 접근, 빈 버퍼에서 removeFirst/removeLast, null 원소</li>
 *   <li>예상 가능한 부재 (반환값): 빈 버퍼에서 popFirst/popLast, 가득 찬 RingBuffer에 append/prepend</li>
 * </ul>
 *
 * <p><strong>동시성:</strong> 구현체는 thread-safe하지 않습니다.
 * 여러 스레드에서 공유하려면 호출자가 외부 동기화를 제공해야 합니다.</p>
 *
 * @param <E> 원소 타입
 * @author Collections Team
 * @since 1.0.0
 */
public interface CircularBuffer<E> extends Iterable<E> {

    /**
     * 원소를 끝에 추가.
     *
     * @param element 추가할 원소
     * @return 추가 성공 여부 (고정 용량 버퍼가 가득 찬 경우 {@code false})
     * @throws IllegalArgumentException element가 null인 경우
     */
    boolean append(E element);

    /**
     * 원소를 앞에 추가.
     *
     * @param element 추가할 원소
     * @return 추가 성공 여부 (고정 용량 버퍼가 가득 찬 경우 {@code false})
     * @throws IllegalArgumentException element가 null인 경우
     */
    boolean prepend(E element);

    /**
     * 원소들을 순서대로 끝에 추가.
     *
     * <p>첫 번째 실패에서 중단합니다. 입력이 {@link java.util.Collection}이면
     * 삽입 전에 null 원소를 검사하므로 null이 섞여 있으면 아무것도 추가되지 않습니다.
     * 그 밖의 Iterable은 null을 만난 시점에 예외가 발생하며, 그 전까지의 삽입은 유지됩니다.</p>
     *
     * @param elements 추가할 원소들
     * @return 실제로 추가된 원소 수
     * @throws IllegalArgumentException elements 또는 원소가 null인 경우
     */
    int appendAll(Iterable<? extends E> elements);

    /**
     * 원소들을 순서대로 하나씩 앞에 추가.
     *
     * <p>첫 번째 실패에서 중단합니다. 입력 순서대로 prepend하므로
     * 결과 버퍼에서는 역순으로 배치됩니다. null 원소 처리는 {@link #appendAll}과 같습니다.</p>
     *
     * @param elements 추가할 원소들
     * @return 실제로 추가된 원소 수
     * @throws IllegalArgumentException elements 또는 원소가 null인 경우
     */
    int prependAll(Iterable<? extends E> elements);

    /**
     * 첫 번째 원소를 꺼냄.
     *
     * @return 첫 번째 원소, 비어 있으면 {@link Optional#empty()}
     */
    Optional<E> popFirst();

    /**
     * 마지막 원소를 꺼냄.
     *
     * @return 마지막 원소, 비어 있으면 {@link Optional#empty()}
     */
    Optional<E> popLast();

    /**
     * 첫 번째 원소를 제거하고 반환.
     *
     * @return 첫 번째 원소
     * @throws NoSuchElementException 버퍼가 비어 있는 경우
     */
    E removeFirst();

    /**
     * 마지막 원소를 제거하고 반환.
     *
     * @return 마지막 원소
     * @throws NoSuchElementException 버퍼가 비어 있는 경우
     */
    E removeLast();

    /**
     * 첫 번째 원소 조회 (제거하지 않음).
     *
     * @return 첫 번째 원소, 비어 있으면 {@link Optional#empty()}
     */
    Optional<E> peekFirst();

    /**
     * 마지막 원소 조회 (제거하지 않음).
     *
     * @return 마지막 원소, 비어 있으면 {@link Optional#empty()}
     */
    Optional<E> peekLast();

    /**
     * 논리 인덱스로 원소 조회.
     *
     * @param index 논리 인덱스 ({@code 0 <= index < size()})
     * @return 원소
     * @throws IndexOutOfBoundsException 범위 밖 인덱스인 경우
     */
    E get(int index);

    /**
     * 논리 인덱스의 원소 교체.
     *
     * @param index 논리 인덱스 ({@code 0 <= index < size()})
     * @param element 새 원소
     * @throws IndexOutOfBoundsException 범위 밖 인덱스인 경우
     * @throws IllegalArgumentException element가 null인 경우
     */
    void set(int index, E element);

    /**
     * 현재 원소 수.
     *
     * @return 원소 수
     */
    int size();

    /**
     * 용량 조회.
     *
     * @return 용량 (의미는 구현체별로 다름)
     */
    int capacity();

    /**
     * 비어 있는지 확인.
     *
     * @return {@code head == tail}이면 true
     */
    boolean isEmpty();

    /**
     * 최소 용량 확보.
     *
     * <p>현재 용량이 충분하면 아무 것도 하지 않습니다. 축소하지 않습니다.</p>
     *
     * @param minimumCapacity 확보할 최소 용량
     */
    void reserveCapacity(int minimumCapacity);

    /**
     * 모든 원소 제거.
     */
    void clear();

    /**
     * 논리 순서대로 원소를 순회하는 Stream.
     *
     * @return Stream
     */
    Stream<E> stream();

    /**
     * 논리 순서대로 원소를 담은 불변 List.
     *
     * @return List
     */
    List<E> toList();
}
