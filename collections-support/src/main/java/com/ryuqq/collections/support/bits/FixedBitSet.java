package com.ryuqq.collections.support.bits;

import java.util.Arrays;
import java.util.Objects;

/**
 * 고정 크기 bit 집합.
 *
 * <p>64-bit word 배열에 bit를 저장합니다. 크기는 생성 시점에 고정되며
 * 범위를 벗어난 인덱스는 {@link IndexOutOfBoundsException}으로 거부됩니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * FixedBitSet seen = new FixedBitSet(100);
 * seen.set(3);
 * seen.isSet(3);       // true
 * seen.cardinality();  // 1
 * </pre>
 *
 * @author Collections Team
 * @since 1.0.0
 */
public final class FixedBitSet {

    private static final int WORD_SHIFT = 6;

    private final long[] words;
    private final int size;

    /**
     * 생성자.
     *
     * @param size bit 수 (양수)
     * @throws IllegalArgumentException size가 0 이하인 경우
     */
    public FixedBitSet(int size) {
        if (size <= 0) {
            throw new IllegalArgumentException(
                "size must be positive (current: " + size + ")"
            );
        }
        this.size = size;
        this.words = new long[((size - 1) >>> WORD_SHIFT) + 1];
    }

    public void set(int index) {
        words[wordIndex(index)] |= mask(index);
    }

    public void clear(int index) {
        words[wordIndex(index)] &= ~mask(index);
    }

    public boolean isSet(int index) {
        return (words[wordIndex(index)] & mask(index)) != 0;
    }

    /**
     * value에 따라 set 또는 clear.
     *
     * @param index bit 인덱스
     * @param value 저장할 값
     */
    public void put(int index, boolean value) {
        if (value) {
            set(index);
        } else {
            clear(index);
        }
    }

    /**
     * 설정된 bit 수 (popcount).
     *
     * @return 1인 bit 수
     */
    public int cardinality() {
        int count = 0;
        for (long word : words) {
            count += Long.bitCount(word);
        }
        return count;
    }

    public int size() {
        return size;
    }

    /**
     * 모든 bit를 0으로 초기화.
     */
    public void clearAll() {
        Arrays.fill(words, 0L);
    }

    private int wordIndex(int index) {
        return Objects.checkIndex(index, size) >>> WORD_SHIFT;
    }

    private static long mask(int index) {
        return 1L << index;
    }

    @Override
    public String toString() {
        return "FixedBitSet{size=" + size + ", cardinality=" + cardinality() + "}";
    }
}
