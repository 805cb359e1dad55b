/**
 * 정렬된 List 탐색 유틸리티.
 *
 * @author Collections Team
 * @since 1.0.0
 */
package com.ryuqq.collections.support.search;
