package com.ryuqq.collections.core.circular;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 고정 용량 링 버퍼.
 *
 * <p>생성 시 지정한 용량을 넘어서 자동으로 확장하지 않습니다.
 * 가득 찬 상태에서 {@link #append(Object)}/{@link #prepend(Object)}는
 * 버퍼를 변경하지 않고 {@code false}를 반환합니다.</p>
 *
 * <p><strong>용량:</strong></p>
 * <ul>
 *   <li>backing store 길이 = {@code size + 1}</li>
 *   <li>{@link #capacity()} = {@code size} (빈 상태와 가득 찬 상태를 구분하기 위한 sentinel 슬롯 1개 제외)</li>
 *   <li>{@link #isFull()} ⟺ {@code size() == capacity()}</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * RingBuffer&lt;String&gt; buffer = new RingBuffer&lt;&gt;(3);
 * buffer.append("a");
 * buffer.append("b");
 * buffer.prepend("z");
 * buffer.append("c");           // false: 가득 참
 * buffer.popFirst();            // Optional["z"]
 * </pre>
 *
 * @param <E> 원소 타입
 * @author Collections Team
 * @since 1.0.0
 */
public final class RingBuffer<E> extends AbstractCircularBuffer<E> {

    private static final Logger log = LoggerFactory.getLogger(RingBuffer.class);

    /**
     * 지정한 용량으로 생성.
     *
     * @param size 용량 (2보다 커야 함)
     * @throws IllegalArgumentException size가 2 이하인 경우
     */
    public RingBuffer(int size) {
        super(validateSize(size) + 1);
    }

    private RingBuffer(RingBuffer<E> source) {
        super(source);
    }

    /**
     * 고정 용량이므로 공간을 만들지 않습니다.
     *
     * @return 항상 {@code false}
     */
    @Override
    protected boolean makeRoom() {
        return false;
    }

    /**
     * {@inheritDoc}
     *
     * @return 사용 가능한 용량 (backing store 길이 - 1)
     */
    @Override
    public int capacity() {
        return backingLength() - 1;
    }

    /**
     * 가득 찼는지 확인.
     *
     * @return {@code (tail + 1) mod backingLength == head}이면 true
     */
    public boolean isFull() {
        return !hasFreeSlot();
    }

    /**
     * 지정한 용량의 새 링 버퍼 생성.
     *
     * <p>원소는 앞에서부터 복사됩니다. {@code newSize}가 현재 원소 수보다 작으면
     * 앞쪽 {@code newSize}개만 남고 나머지는 버려집니다. 이 버퍼는 변경되지 않습니다.</p>
     *
     * @param newSize 새 용량 (2보다 커야 함)
     * @return 원소가 복사된 새 RingBuffer
     * @throws IllegalArgumentException newSize가 2 이하인 경우
     */
    public RingBuffer<E> resized(int newSize) {
        RingBuffer<E> resized = new RingBuffer<>(newSize);
        int keep = Math.min(size(), newSize);
        for (int i = 0; i < keep; i++) {
            resized.append(get(i));
        }
        return resized;
    }

    /**
     * 용량을 제자리에서 변경.
     *
     * <p>{@link #resized(int)}와 같은 규칙으로 앞쪽 원소만 유지합니다.</p>
     *
     * @param newSize 새 용량 (2보다 커야 함)
     * @throws IllegalArgumentException newSize가 2 이하인 경우
     */
    public void resize(int newSize) {
        validateSize(newSize);
        int before = size();
        int keep = Math.min(before, newSize);
        relocate(newSize + 1, keep);
        log.debug("RingBuffer resized: capacity {}, kept {} of {} elements", newSize, keep, before);
    }

    /**
     * {@inheritDoc}
     *
     * <p>용량을 {@code minimumCapacity} 이상으로 늘립니다. 원소는 보존됩니다.</p>
     */
    @Override
    public void reserveCapacity(int minimumCapacity) {
        if (capacity() >= minimumCapacity) {
            return;
        }
        resize(minimumCapacity);
    }

    /**
     * 모든 원소를 제거하고 필요 시 용량 변경.
     *
     * @param resizingTo 새 용량, 0 이하이면 현재 용량 유지
     * @throws IllegalArgumentException resizingTo가 1 또는 2인 경우
     */
    public void clear(int resizingTo) {
        if (resizingTo > 0) {
            validateSize(resizingTo);
        }
        clear();
        if (resizingTo > 0) {
            resize(resizingTo);
        }
    }

    /**
     * 독립적인 복사본 생성.
     *
     * <p>복사본과 원본은 backing store를 공유하지 않습니다.</p>
     *
     * @return 같은 용량과 원소를 가진 새 RingBuffer
     */
    public RingBuffer<E> copy() {
        return new RingBuffer<>(this);
    }

    private static int validateSize(int size) {
        if (size <= 2) {
            throw new IllegalArgumentException(
                "size must be greater than 2 (current: " + size + ")"
            );
        }
        return size;
    }
}
