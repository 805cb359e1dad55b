package com.ryuqq.collections.core.ticket;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.function.BiConsumer;

/**
 * 안정적인 식별자를 발급하는 map (coatcheck 구조).
 *
 * <p>원소를 추가하면 단조 증가하는 정수 식별자(ticket)를 발급합니다.
 * 발급된 식별자는 원소가 제거된 뒤에도 재사용되지 않습니다.
 * 연결이나 요청처럼 일정 시간 후 무효화되는 항목을 식별자로 추적할 때 적합하며,
 * 모든 원소를 삽입 순서로 순회하는 비용이 낮습니다.</p>
 *
 * <p><strong>자료 구조:</strong></p>
 * <ul>
 *   <li>slots: (id, element) 레코드 목록, 항상 id 오름차순 정렬 (id는 꼬리에만 추가되므로 정렬 유지 비용 없음)</li>
 *   <li>nextId: 다음에 발급할 식별자</li>
 *   <li>size: 살아 있는 원소 수 ({@code size <= slots.size()})</li>
 * </ul>
 *
 * <p><strong>성능 특성:</strong></p>
 * <ul>
 *   <li>append: O(1)</li>
 *   <li>get / contains: O(log N) - id 기준 이진 탐색</li>
 *   <li>remove: O(log N) 탐색 + amortized O(N) compaction</li>
 *   <li>순회: O(slots) - tombstone은 건너뜀</li>
 * </ul>
 *
 * <p><strong>Tombstone과 Compaction:</strong></p>
 * <ul>
 *   <li>remove는 레코드의 원소만 비우고(tombstone) id는 제자리에 남겨 정렬을 유지합니다.</li>
 *   <li>{@code size < floor(slots.size() × compactionRatio)}가 되면 tombstone을 모두 제거합니다.</li>
 *   <li>기본 비율 {@value #DEFAULT_COMPACTION_RATIO}에서 tombstone 비율은 amortized 50% 이하입니다.</li>
 * </ul>
 *
 * <p><strong>주의:</strong> {@link #get(long)}은 "발급된 적 없는 id"와 "이미 제거된 id"를
 * 구분하지 않습니다. 두 경우 모두 {@link Optional#empty()}를 반환합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * TicketMap&lt;Connection&gt; connections = new TicketMap&lt;&gt;();
 * long id = connections.append(connection);
 *
 * connections.get(id);        // Optional[connection]
 * connections.remove(id);     // Optional[connection]
 * connections.remove(id);     // Optional.empty()
 * </pre>
 *
 * @param <E> 원소 타입
 * @author Collections Team
 * @since 1.0.0
 */
public final class TicketMap<E> implements Iterable<E> {

    private static final Logger log = LoggerFactory.getLogger(TicketMap.class);

    /**
     * 기본 compaction 비율.
     */
    public static final double DEFAULT_COMPACTION_RATIO = 0.5;

    private final double compactionRatio;
    private ArrayList<Slot<E>> slots;
    private int size;
    private long nextId;

    /**
     * 기본 compaction 비율({@value #DEFAULT_COMPACTION_RATIO})로 생성.
     */
    public TicketMap() {
        this(DEFAULT_COMPACTION_RATIO);
    }

    /**
     * 지정한 compaction 비율로 생성.
     *
     * @param compactionRatio 살아 있는 원소 비율이 이 값 아래로 떨어지면 compaction 수행 (0 초과 1 이하)
     * @throws IllegalArgumentException compactionRatio가 범위를 벗어난 경우
     */
    public TicketMap(double compactionRatio) {
        if (!(compactionRatio > 0.0 && compactionRatio <= 1.0)) {
            throw new IllegalArgumentException(
                "compactionRatio must be in (0.0, 1.0] (current: " + compactionRatio + ")"
            );
        }
        this.compactionRatio = compactionRatio;
        this.slots = new ArrayList<>();
    }

    private TicketMap(TicketMap<E> source) {
        this.compactionRatio = source.compactionRatio;
        this.slots = new ArrayList<>(source.size);
        for (Slot<E> slot : source.slots) {
            if (slot.element != null) {
                this.slots.add(new Slot<>(slot.id, slot.element));
            }
        }
        this.size = source.size;
        this.nextId = source.nextId;
    }

    /**
     * 원소를 추가하고 식별자 발급.
     *
     * @param element 추가할 원소
     * @return 발급된 식별자
     * @throws IllegalArgumentException element가 null인 경우
     */
    public long append(E element) {
        requireElement(element);
        long id = nextId;
        slots.add(new Slot<>(id, element));
        size++;
        nextId++;
        return id;
    }

    /**
     * 원소들을 순서대로 추가.
     *
     * <p>입력이 {@link Collection}이면 null 원소를 먼저 검사하므로, null이 섞여 있으면
     * 식별자를 하나도 발급하지 않습니다. 그 밖의 Iterable은 null을 만난 시점에 예외가
     * 발생하며, 그 전에 추가된 원소는 남고 발급된 식별자는 반환되지 않습니다.</p>
     *
     * @param elements 추가할 원소들
     * @return 입력 순서와 같은 순서의 발급 식별자 목록
     * @throws IllegalArgumentException elements 또는 원소가 null인 경우
     */
    public List<Long> appendAll(Iterable<? extends E> elements) {
        if (elements == null) {
            throw new IllegalArgumentException("elements cannot be null");
        }
        if (elements instanceof Collection) {
            for (Object element : (Collection<?>) elements) {
                requireElement(element);
            }
        }
        List<Long> ids = new ArrayList<>();
        for (E element : elements) {
            ids.add(append(element));
        }
        return ids;
    }

    /**
     * 식별자로 원소 조회.
     *
     * @param id 식별자
     * @return 원소, 발급된 적 없거나 이미 제거된 경우 {@link Optional#empty()}
     */
    public Optional<E> get(long id) {
        int index = findIndex(id);
        if (index < 0) {
            return Optional.empty();
        }
        return Optional.ofNullable(slots.get(index).element);
    }

    /**
     * 식별자에 살아 있는 원소가 있는지 확인.
     *
     * @param id 식별자
     * @return 살아 있는 원소가 있으면 true
     */
    public boolean contains(long id) {
        return get(id).isPresent();
    }

    /**
     * 식별자의 원소 제거.
     *
     * <p>레코드를 tombstone으로 만들고, 필요 시 compaction을 수행합니다.
     * 없는 식별자나 이미 제거된 식별자는 아무 것도 변경하지 않습니다.</p>
     *
     * @param id 식별자
     * @return 제거된 원소, 없으면 {@link Optional#empty()}
     */
    public Optional<E> remove(long id) {
        int index = findIndex(id);
        if (index < 0) {
            return Optional.empty();
        }
        Slot<E> slot = slots.get(index);
        E element = slot.element;
        if (element == null) {
            return Optional.empty();
        }

        slot.element = null;
        size--;
        if (size < compactionThreshold()) {
            compact();
        }
        return Optional.of(element);
    }

    /**
     * 살아 있는 원소 수.
     *
     * @return 원소 수
     */
    public int size() {
        return size;
    }

    /**
     * 비어 있는지 확인.
     *
     * @return 살아 있는 원소가 없으면 true
     */
    public boolean isEmpty() {
        return size == 0;
    }

    /**
     * 다음 append에서 발급될 식별자.
     *
     * @return 다음 식별자
     */
    public long nextId() {
        return nextId;
    }

    /**
     * compaction 비율 조회.
     *
     * @return compaction 비율
     */
    public double compactionRatio() {
        return compactionRatio;
    }

    /**
     * 살아 있는 원소를 식별자 오름차순으로 전달.
     *
     * @param action (식별자, 원소)를 받는 콜백
     * @throws IllegalArgumentException action이 null인 경우
     */
    public void forEachTicket(BiConsumer<Long, ? super E> action) {
        if (action == null) {
            throw new IllegalArgumentException("action cannot be null");
        }
        for (Slot<E> slot : slots) {
            if (slot.element != null) {
                action.accept(slot.id, slot.element);
            }
        }
    }

    /**
     * 살아 있는 (식별자, 원소) 쌍 목록.
     *
     * @return 식별자 오름차순의 불변 목록
     */
    public List<Ticket<E>> entries() {
        List<Ticket<E>> entries = new ArrayList<>(size);
        forEachTicket((id, element) -> entries.add(new Ticket<>(id, element)));
        return List.copyOf(entries);
    }

    /**
     * 모든 원소 제거.
     *
     * <p>식별자 카운터는 초기화하지 않습니다. 이후에도 새 식별자만 발급됩니다.</p>
     */
    public void clear() {
        slots = new ArrayList<>();
        size = 0;
    }

    /**
     * 독립적인 복사본 생성.
     *
     * <p>복사본은 tombstone 없이 살아 있는 레코드만 가지며,
     * 원본과 같은 {@link #nextId()}부터 식별자를 발급합니다.</p>
     *
     * @return 새 TicketMap
     */
    public TicketMap<E> copy() {
        return new TicketMap<>(this);
    }

    /**
     * 살아 있는 원소를 식별자(삽입) 순서로 순회.
     *
     * <p>순회 중 map을 변경하는 것은 지원하지 않으며 감지하지도 않습니다.</p>
     */
    @Override
    public Iterator<E> iterator() {
        return new LiveElementIterator();
    }

    /**
     * tombstone을 포함한 레코드 수. compaction 검증용.
     *
     * @return 레코드 수
     */
    int slotCount() {
        return slots.size();
    }

    /**
     * 식별자 기준 이진 탐색.
     *
     * <p>반열린 구간 [low, high)를 사용하며, 중간값은 {@code low + (high - low) / 2}로 계산합니다.</p>
     *
     * @param id 식별자
     * @return 레코드 위치, 없으면 -1
     */
    int findIndex(long id) {
        int low = 0;
        int high = slots.size();
        while (low < high) {
            int mid = low + (high - low) / 2;
            long midId = slots.get(mid).id;
            if (midId == id) {
                return mid;
            } else if (midId < id) {
                low = mid + 1;
            } else {
                high = mid;
            }
        }
        return -1;
    }

    private long compactionThreshold() {
        return (long) (slots.size() * compactionRatio);
    }

    private static void requireElement(Object element) {
        if (element == null) {
            throw new IllegalArgumentException("element cannot be null");
        }
    }

    private void compact() {
        int before = slots.size();
        ArrayList<Slot<E>> live = new ArrayList<>(size);
        for (Slot<E> slot : slots) {
            if (slot.element != null) {
                live.add(slot);
            }
        }
        slots = live;
        log.debug("TicketMap compacted: {} -> {} slots", before, live.size());
    }

    @Override
    public String toString() {
        return "TicketMap{size=" + size + ", nextId=" + nextId + ", entries=" + entries() + '}';
    }

    /**
     * id와 원소를 담는 레코드. {@code element == null}이면 tombstone.
     */
    private static final class Slot<E> {
        private final long id;
        private E element;

        Slot(long id, E element) {
            this.id = id;
            this.element = element;
        }
    }

    private final class LiveElementIterator implements Iterator<E> {
        private final List<Slot<E>> snapshot = slots;
        private int index;

        @Override
        public boolean hasNext() {
            while (index < snapshot.size()) {
                if (snapshot.get(index).element != null) {
                    return true;
                }
                index++;
            }
            return false;
        }

        @Override
        public E next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            return snapshot.get(index++).element;
        }
    }
}
