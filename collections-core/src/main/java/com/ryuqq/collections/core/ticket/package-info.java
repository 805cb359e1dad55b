/**
 * Ticket map (coatcheck) 패키지.
 *
 * <p>원소마다 재사용되지 않는 식별자를 발급하고, 정렬된 레코드 목록에 대한
 * 이진 탐색으로 조회/제거하는 {@link com.ryuqq.collections.core.ticket.TicketMap}을 제공합니다.</p>
 *
 * @author Collections Team
 * @since 1.0.0
 */
package com.ryuqq.collections.core.ticket;
