/**
 * 고정 크기 bit 집합.
 *
 * @author Collections Team
 * @since 1.0.0
 */
package com.ryuqq.collections.support.bits;
