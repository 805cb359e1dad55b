package com.ryuqq.collections.core.circular;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 가변 용량 양방향 배열 (deque).
 *
 * <p>append/prepend는 amortized O(1)이며 실패하지 않습니다.
 * 빈 슬롯이 없으면 backing store를 {@link #GROWTH_FACTOR}배로 확장한 뒤 삽입합니다.
 * 논리 인덱스 접근은 O(1)입니다.</p>
 *
 * <p><strong>용량:</strong> {@link #capacity()}는 backing store 길이를 반환합니다.
 * 빈 상태와 가득 찬 상태를 구분하기 위해 한 슬롯은 항상 비워 두므로,
 * 마지막 슬롯을 쓰기 전에 확장이 일어납니다.</p>
 *
 * <p><strong>확장 예시 (기본 생성자):</strong></p>
 * <ul>
 *   <li>2 → 4 → 7 → 12 → 20 → 33 → ...</li>
 *   <li>새 길이 = {@code ceil(1.618 × 이전 길이)}</li>
 * </ul>
 *
 * @param <E> 원소 타입
 * @author Collections Team
 * @since 1.0.0
 */
public final class DoubleEndedArray<E> extends AbstractCircularBuffer<E> {

    private static final Logger log = LoggerFactory.getLogger(DoubleEndedArray.class);

    /**
     * 확장 배율 (황금비 근사값).
     */
    public static final double GROWTH_FACTOR = 1.618;

    /**
     * 기본 생성자의 backing store 길이.
     */
    public static final int DEFAULT_CAPACITY = 2;

    // JVM 배열 길이 한계 (ArrayList와 동일한 여유분)
    private static final int MAX_BACKING_LENGTH = Integer.MAX_VALUE - 8;

    /**
     * 기본 용량({@value #DEFAULT_CAPACITY})으로 생성.
     */
    public DoubleEndedArray() {
        super(DEFAULT_CAPACITY);
    }

    /**
     * 지정한 용량을 미리 확보하여 생성.
     *
     * @param reservingCapacity 초기 backing store 길이 (2 이상이어야 함)
     * @throws IllegalArgumentException reservingCapacity가 2 미만인 경우
     */
    public DoubleEndedArray(int reservingCapacity) {
        super(validateCapacity(reservingCapacity));
    }

    private DoubleEndedArray(DoubleEndedArray<E> source) {
        super(source);
    }

    /**
     * 주어진 원소들을 순서대로 담은 배열 생성.
     *
     * @param elements 원소들
     * @param <E> 원소 타입
     * @return 새 DoubleEndedArray
     * @throws IllegalArgumentException elements 또는 원소가 null인 경우
     */
    @SafeVarargs
    public static <E> DoubleEndedArray<E> of(E... elements) {
        if (elements == null) {
            throw new IllegalArgumentException("elements cannot be null");
        }
        DoubleEndedArray<E> array = new DoubleEndedArray<>(Math.max(DEFAULT_CAPACITY, elements.length + 1));
        for (E element : elements) {
            array.append(element);
        }
        return array;
    }

    /**
     * backing store를 확장하여 공간 확보.
     *
     * @return 항상 {@code true}
     */
    @Override
    protected boolean makeRoom() {
        grow(nextLength(backingLength()));
        return true;
    }

    /**
     * {@inheritDoc}
     *
     * @return backing store 길이
     */
    @Override
    public int capacity() {
        return backingLength();
    }

    /**
     * {@inheritDoc}
     *
     * <p>backing store 길이를 {@code minimumCapacity} 이상으로 늘립니다.</p>
     */
    @Override
    public void reserveCapacity(int minimumCapacity) {
        if (backingLength() >= minimumCapacity) {
            return;
        }
        grow(minimumCapacity);
    }

    /**
     * 모든 원소 제거.
     *
     * @param keepingCapacity true이면 backing store 유지, false이면 기본 용량으로 초기화
     */
    public void clear(boolean keepingCapacity) {
        if (keepingCapacity) {
            clear();
        } else {
            relocate(DEFAULT_CAPACITY, 0);
        }
    }

    /**
     * 독립적인 복사본 생성.
     *
     * <p>복사본과 원본은 backing store를 공유하지 않습니다.</p>
     *
     * @return 같은 용량과 원소를 가진 새 DoubleEndedArray
     */
    public DoubleEndedArray<E> copy() {
        return new DoubleEndedArray<>(this);
    }

    private void grow(int newLength) {
        int oldLength = backingLength();
        relocate(newLength, size());
        log.debug("DoubleEndedArray grown: {} -> {} slots ({} elements)", oldLength, newLength, size());
    }

    static int nextLength(int currentLength) {
        if (currentLength >= MAX_BACKING_LENGTH) {
            throw new OutOfMemoryError("DoubleEndedArray cannot grow beyond " + MAX_BACKING_LENGTH + " slots");
        }
        double next = Math.ceil(GROWTH_FACTOR * currentLength);
        return (int) Math.min(next, MAX_BACKING_LENGTH);
    }

    private static int validateCapacity(int reservingCapacity) {
        if (reservingCapacity < DEFAULT_CAPACITY) {
            throw new IllegalArgumentException(
                "reservingCapacity must be at least " + DEFAULT_CAPACITY + " (current: " + reservingCapacity + ")"
            );
        }
        return reservingCapacity;
    }
}
