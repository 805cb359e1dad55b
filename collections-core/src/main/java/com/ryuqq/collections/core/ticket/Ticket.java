package com.ryuqq.collections.core.ticket;

/**
 * {@link TicketMap}가 발급한 식별자와 원소의 쌍.
 *
 * @param id 발급된 식별자 (0 이상)
 * @param element 살아 있는 원소 (null 불가)
 * @param <E> 원소 타입
 * @author Collections Team
 * @since 1.0.0
 */
public record Ticket<E>(long id, E element) {

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public Ticket {
        if (id < 0) {
            throw new IllegalArgumentException("id must not be negative (current: " + id + ")");
        }
        if (element == null) {
            throw new IllegalArgumentException("element cannot be null");
        }
    }
}
