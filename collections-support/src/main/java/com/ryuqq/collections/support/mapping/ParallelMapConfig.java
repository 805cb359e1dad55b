package com.ryuqq.collections.support.mapping;

/**
 * ParallelMapper 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>parallelism: worker 스레드 수 (기본 availableProcessors)</li>
 *   <li>blockSize: 한 worker 작업이 처리할 연속 원소 수 (기본 0 = 입력 크기에서 계산)</li>
 * </ul>
 *
 * <p>blockSize가 0이면 {@code ceil(n / parallelism)}을 사용해 worker당 한 블록이 되도록 나눕니다.
 * 변환 비용이 원소마다 크게 다르면 작은 blockSize가 부하를 고르게 분산합니다.</p>
 *
 * @author Collections Team
 * @since 1.0.0
 * @param parallelism worker 스레드 수 (1 이상이어야 함)
 * @param blockSize 블록 크기 (0 이상이어야 함, 0은 자동 계산)
 */
public record ParallelMapConfig(
    int parallelism,
    int blockSize
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: parallelism=availableProcessors, blockSize=0 (자동)</p>
     */
    public ParallelMapConfig() {
        this(Runtime.getRuntime().availableProcessors(), 0);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public ParallelMapConfig {
        if (parallelism <= 0) {
            throw new IllegalArgumentException(
                "parallelism must be positive (current: " + parallelism + ")"
            );
        }
        if (blockSize < 0) {
            throw new IllegalArgumentException(
                "blockSize must not be negative (current: " + blockSize + ")"
            );
        }
    }

    /**
     * parallelism만 변경한 새 인스턴스 생성.
     */
    public ParallelMapConfig withParallelism(int parallelism) {
        return new ParallelMapConfig(parallelism, blockSize);
    }

    /**
     * blockSize만 변경한 새 인스턴스 생성.
     */
    public ParallelMapConfig withBlockSize(int blockSize) {
        return new ParallelMapConfig(parallelism, blockSize);
    }

    /**
     * 입력 크기 n에 적용할 실제 블록 크기.
     *
     * @param n 입력 원소 수
     * @return 1 이상의 블록 크기
     */
    public int effectiveBlockSize(int n) {
        if (blockSize > 0) {
            return blockSize;
        }
        int derived = (int) ((n + (long) parallelism - 1) / parallelism);
        return Math.max(1, derived);
    }
}
