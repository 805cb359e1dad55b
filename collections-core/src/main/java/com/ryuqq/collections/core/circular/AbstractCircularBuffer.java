package com.ryuqq.collections.core.circular;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * {@link CircularBuffer}의 공통 모듈러 인덱스 구현.
 *
 * <p><strong>구조:</strong></p>
 * <ul>
 *   <li>{@code slots}: backing store, {@code null}은 빈 슬롯</li>
 *   <li>{@code head}: 첫 원소의 물리 인덱스</li>
 *   <li>{@code tail}: 마지막 원소 다음 칸의 물리 인덱스</li>
 * </ul>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>{@code head == tail} ⟺ 비어 있음</li>
 *   <li>{@code (tail + 1) mod slots.length == head} ⟺ 남은 슬롯 없음
 *       (한 슬롯은 항상 비워 두어 가득 찬 상태와 빈 상태의 인덱스가 겹치지 않음)</li>
 *   <li>원소 수는 인덱스에서 계산하며 저장하지 않음</li>
 * </ul>
 *
 * <p>남은 슬롯이 없을 때의 동작은 하위 클래스가 {@link #makeRoom()}으로 결정합니다.
 * 인덱스를 0으로 정규화하는 곳은 {@link #relocate(int, int)}뿐입니다.</p>
 *
 * @param <E> 원소 타입
 * @author Collections Team
 * @since 1.0.0
 */
public abstract class AbstractCircularBuffer<E> implements CircularBuffer<E> {

    private Object[] slots;
    private int head;
    private int tail;

    /**
     * 주어진 backing 길이의 빈 버퍼 생성.
     *
     * @param backingLength 물리 슬롯 수 (2 이상)
     */
    protected AbstractCircularBuffer(int backingLength) {
        if (backingLength < 2) {
            throw new IllegalArgumentException(
                "backingLength must be at least 2 (current: " + backingLength + ")"
            );
        }
        this.slots = new Object[backingLength];
    }

    /**
     * 같은 backing 길이를 갖는 독립 복사본 생성.
     *
     * @param source 복사할 버퍼
     */
    protected AbstractCircularBuffer(AbstractCircularBuffer<E> source) {
        if (source == null) {
            throw new IllegalArgumentException("source cannot be null");
        }
        this.slots = new Object[source.slots.length];
        int count = source.size();
        for (int i = 0; i < count; i++) {
            this.slots[i] = source.slots[source.physicalIndex(i)];
        }
        this.head = 0;
        this.tail = count;
    }

    /**
     * 삽입 시 빈 슬롯이 없을 때 호출.
     *
     * @return 공간을 확보했으면 {@code true}, 변경 없이 삽입을 실패시켜야 하면 {@code false}
     */
    protected abstract boolean makeRoom();

    @Override
    public boolean append(E element) {
        requireElement(element);
        if (!hasFreeSlot() && !makeRoom()) {
            return false;
        }
        slots[tail] = element;
        tail = (tail + 1) % slots.length;
        return true;
    }

    @Override
    public boolean prepend(E element) {
        requireElement(element);
        if (!hasFreeSlot() && !makeRoom()) {
            return false;
        }
        head = (head + slots.length - 1) % slots.length;
        slots[head] = element;
        return true;
    }

    @Override
    public int appendAll(Iterable<? extends E> elements) {
        requireElements(elements);
        int appended = 0;
        for (E element : elements) {
            if (!append(element)) {
                break;
            }
            appended++;
        }
        return appended;
    }

    @Override
    public int prependAll(Iterable<? extends E> elements) {
        requireElements(elements);
        int prepended = 0;
        for (E element : elements) {
            if (!prepend(element)) {
                break;
            }
            prepended++;
        }
        return prepended;
    }

    @Override
    public Optional<E> popFirst() {
        if (isEmpty()) {
            return Optional.empty();
        }
        E element = elementAt(head);
        slots[head] = null;
        head = (head + 1) % slots.length;
        return Optional.of(element);
    }

    @Override
    public Optional<E> popLast() {
        if (isEmpty()) {
            return Optional.empty();
        }
        int last = (tail + slots.length - 1) % slots.length;
        E element = elementAt(last);
        slots[last] = null;
        tail = last;
        return Optional.of(element);
    }

    @Override
    public E removeFirst() {
        return popFirst().orElseThrow(() -> new NoSuchElementException("removeFirst on empty buffer"));
    }

    @Override
    public E removeLast() {
        return popLast().orElseThrow(() -> new NoSuchElementException("removeLast on empty buffer"));
    }

    @Override
    public Optional<E> peekFirst() {
        return isEmpty() ? Optional.empty() : Optional.of(elementAt(head));
    }

    @Override
    public Optional<E> peekLast() {
        return isEmpty() ? Optional.empty() : Optional.of(elementAt((tail + slots.length - 1) % slots.length));
    }

    @Override
    public E get(int index) {
        Objects.checkIndex(index, size());
        return elementAt(physicalIndex(index));
    }

    @Override
    public void set(int index, E element) {
        Objects.checkIndex(index, size());
        requireElement(element);
        slots[physicalIndex(index)] = element;
    }

    @Override
    public int size() {
        return tail >= head ? tail - head : slots.length - head + tail;
    }

    @Override
    public boolean isEmpty() {
        return head == tail;
    }

    @Override
    public void clear() {
        Arrays.fill(slots, null);
        head = 0;
        tail = 0;
    }

    @Override
    public Iterator<E> iterator() {
        return new Cursor();
    }

    @Override
    public Stream<E> stream() {
        Spliterator<E> spliterator = Spliterators.spliterator(
            iterator(),
            size(),
            Spliterator.ORDERED | Spliterator.NONNULL
        );
        return StreamSupport.stream(spliterator, false);
    }

    @Override
    public List<E> toList() {
        int count = size();
        List<E> elements = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            elements.add(elementAt(physicalIndex(i)));
        }
        return Collections.unmodifiableList(elements);
    }

    /**
     * backing store의 물리 슬롯 수.
     *
     * @return backing 길이
     */
    protected final int backingLength() {
        return slots.length;
    }

    /**
     * sentinel 슬롯을 건드리지 않고 원소 하나를 더 넣을 수 있는지 여부.
     *
     * @return 제자리 append/prepend가 가능하면 {@code true}
     */
    protected final boolean hasFreeSlot() {
        return (tail + 1) % slots.length != head;
    }

    /**
     * backing store를 {@code newLength} 슬롯의 새 배열로 교체.
     *
     * <p>앞쪽 {@code keep}개 원소를 논리 순서대로 물리 인덱스 0부터 옮깁니다.</p>
     *
     * @param newLength 새 backing 길이 ({@code keep}보다 커야 함)
     * @param keep 옮길 앞쪽 원소 수 ({@link #size()} 이하)
     */
    protected final void relocate(int newLength, int keep) {
        if (keep < 0 || keep > size()) {
            throw new IllegalArgumentException(
                "keep must be between 0 and " + size() + " (current: " + keep + ")"
            );
        }
        if (newLength <= keep) {
            throw new IllegalArgumentException(
                "newLength must be greater than keep (newLength: " + newLength + ", keep: " + keep + ")"
            );
        }
        Object[] relocated = new Object[newLength];
        for (int i = 0; i < keep; i++) {
            relocated[i] = slots[physicalIndex(i)];
        }
        slots = relocated;
        head = 0;
        tail = keep;
    }

    private int physicalIndex(int logicalIndex) {
        return (head + logicalIndex) % slots.length;
    }

    private E elementAt(int physicalIndex) {
        return cast(slots[physicalIndex]);
    }

    @SuppressWarnings("unchecked")
    private static <T> T cast(Object slot) {
        return (T) slot;
    }

    private static void requireElement(Object element) {
        if (element == null) {
            throw new IllegalArgumentException("element cannot be null");
        }
    }

    // Collection이면 삽입 전에 null을 검사하므로 null이 섞인 입력은 버퍼를 바꾸지 않음
    private static void requireElements(Iterable<?> elements) {
        if (elements == null) {
            throw new IllegalArgumentException("elements cannot be null");
        }
        if (elements instanceof Collection) {
            for (Object element : (Collection<?>) elements) {
                requireElement(element);
            }
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        AbstractCircularBuffer<?> other = (AbstractCircularBuffer<?>) o;
        int count = size();
        if (count != other.size()) {
            return false;
        }
        for (int i = 0; i < count; i++) {
            if (!slots[physicalIndex(i)].equals(other.slots[other.physicalIndex(i)])) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        int result = 1;
        int count = size();
        for (int i = 0; i < count; i++) {
            result = 31 * result + slots[physicalIndex(i)].hashCode();
        }
        return result;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + toList();
    }

    /**
     * 생성 시점의 backing store 참조, head, 원소 수를 기준으로 순회.
     * 순회 중 버퍼 변경은 지원하지 않으며 감지하지도 않습니다.
     */
    private final class Cursor implements Iterator<E> {
        private final Object[] snapshot = slots;
        private final int start = head;
        private final int count = size();
        private int index;

        @Override
        public boolean hasNext() {
            return index < count;
        }

        @Override
        public E next() {
            if (index >= count) {
                throw new NoSuchElementException();
            }
            E element = cast(snapshot[(start + index) % snapshot.length]);
            index++;
            return element;
        }
    }
}
