package com.ryuqq.collections.support.mapping;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.function.IntFunction;

/**
 * 블록 단위 병렬 map.
 *
 * <p>입력을 연속된 블록으로 나누어 고정 크기 worker pool에서 변환한 뒤,
 * 원래 순서대로 이어 붙입니다. 결과는 항상 {@link ArrayMapping#map}과 같습니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * map(source, transform)
 *   ↓
 * partition: [0, b), [b, 2b), ... (b = config.effectiveBlockSize(n))
 *   ↓
 * 각 블록을 worker pool에 제출 → 블록별 결과 List
 *   ↓
 * 제출 순서대로 Future.get() → 결과 연결
 * </pre>
 *
 * <p><strong>실패 처리:</strong></p>
 * <ul>
 *   <li>transform이 던진 RuntimeException/Error는 그대로 호출자에게 다시 던짐</li>
 *   <li>checked 예외는 {@link IllegalStateException}으로 감쌈</li>
 *   <li>한 블록이 실패하면 아직 끝나지 않은 블록은 취소</li>
 *   <li>대기 중 인터럽트: interrupt 플래그 복원 후 {@link IllegalStateException}</li>
 * </ul>
 *
 * <p>transform은 여러 worker에서 동시에 호출되므로 thread-safe해야 합니다.
 * 사용이 끝나면 {@link #close()}로 pool을 반납하세요.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * try (ParallelMapper mapper = new ParallelMapper(new ParallelMapConfig().withBlockSize(1024))) {
 *     List&lt;Integer&gt; squares = mapper.map(values, v -&gt; v * v);
 * }
 * </pre>
 *
 * @author Collections Team
 * @since 1.0.0
 */
public final class ParallelMapper implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ParallelMapper.class);

    private static final long SHUTDOWN_TIMEOUT_SECONDS = 60;

    private final ParallelMapConfig config;
    private final ExecutorService workerExecutor;

    /**
     * 기본 설정으로 생성.
     */
    public ParallelMapper() {
        this(new ParallelMapConfig());
    }

    /**
     * 생성자.
     *
     * @param config 설정
     * @throws IllegalArgumentException config가 null인 경우
     */
    public ParallelMapper(ParallelMapConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.config = config;
        this.workerExecutor = Executors.newFixedThreadPool(config.parallelism());
        log.debug("ParallelMapper created with parallelism={}, blockSize={}",
            config.parallelism(), config.blockSize());
    }

    public ParallelMapConfig config() {
        return config;
    }

    /**
     * source의 각 원소를 병렬로 변환.
     *
     * @param source 입력 List (RandomAccess 권장)
     * @param transform thread-safe 변환 함수
     * @param <T> 입력 타입
     * @param <R> 결과 타입
     * @return 입력 순서를 유지한 결과 (수정 가능)
     * @throws IllegalArgumentException 인자가 null인 경우
     * @throws IllegalStateException pool이 종료되었거나, 대기 중 인터럽트되었거나, checked 예외가 발생한 경우
     */
    public <T, R> List<R> map(List<? extends T> source, Function<? super T, ? extends R> transform) {
        if (source == null) {
            throw new IllegalArgumentException("source cannot be null");
        }
        if (transform == null) {
            throw new IllegalArgumentException("transform cannot be null");
        }
        return run(0, source.size(), index -> transform.apply(source.get(index)));
    }

    /**
     * 정수 구간 [from, to)의 각 값을 병렬로 변환.
     *
     * @param from 시작 (포함)
     * @param to 끝 (미포함)
     * @param transform thread-safe 변환 함수
     * @param <R> 결과 타입
     * @return {@code to - from}개의 결과, 구간 순서 유지
     * @throws IllegalArgumentException {@code from > to}이거나, 구간 길이가 {@code Integer.MAX_VALUE}를 넘거나,
     *         transform이 null인 경우
     */
    public <R> List<R> mapRange(int from, int to, IntFunction<? extends R> transform) {
        if (from > to) {
            throw new IllegalArgumentException(
                "from must not exceed to (current: from=" + from + ", to=" + to + ")"
            );
        }
        long span = (long) to - from;
        if (span > Integer.MAX_VALUE) {
            throw new IllegalArgumentException(
                "range must not exceed " + Integer.MAX_VALUE + " elements (current: " + span + ")"
            );
        }
        if (transform == null) {
            throw new IllegalArgumentException("transform cannot be null");
        }
        return run(from, to, transform);
    }

    private <R> List<R> run(int from, int to, IntFunction<? extends R> elementAt) {
        if (workerExecutor.isShutdown()) {
            throw new IllegalStateException("ParallelMapper is shut down");
        }

        int count = to - from;
        List<R> result = new ArrayList<>(count);
        if (count == 0) {
            return result;
        }

        int blockSize = config.effectiveBlockSize(count);
        List<Future<List<R>>> blocks = new ArrayList<>((count - 1) / blockSize + 1);
        for (int start = from; start < to; start += Math.min(blockSize, to - start)) {
            int blockStart = start;
            int blockEnd = start + Math.min(blockSize, to - start);
            blocks.add(workerExecutor.submit(() -> mapBlock(blockStart, blockEnd, elementAt)));
        }
        log.debug("Partitioned {} elements into {} blocks of up to {}", count, blocks.size(), blockSize);

        for (int i = 0; i < blocks.size(); i++) {
            try {
                result.addAll(blocks.get(i).get());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                cancelFrom(blocks, i);
                throw new IllegalStateException("Interrupted while waiting for block " + i, e);
            } catch (ExecutionException e) {
                cancelFrom(blocks, i + 1);
                Throwable cause = e.getCause();
                log.error("Block {} of {} failed", i, blocks.size(), cause);
                if (cause instanceof RuntimeException runtimeException) {
                    throw runtimeException;
                }
                if (cause instanceof Error error) {
                    throw error;
                }
                throw new IllegalStateException("Block " + i + " failed", cause);
            }
        }
        return result;
    }

    private static <R> List<R> mapBlock(int from, int to, IntFunction<? extends R> elementAt) {
        List<R> block = new ArrayList<>(to - from);
        for (int index = from; index < to; index++) {
            block.add(elementAt.apply(index));
        }
        return block;
    }

    private static void cancelFrom(List<? extends Future<?>> blocks, int first) {
        for (int i = first; i < blocks.size(); i++) {
            blocks.get(i).cancel(true);
        }
    }

    public boolean isShutdown() {
        return workerExecutor.isShutdown();
    }

    /**
     * Worker pool 종료.
     *
     * <p>진행 중인 블록이 끝날 때까지 최대 60초 대기한 뒤, 남은 작업은 강제 종료합니다.</p>
     *
     * @throws InterruptedException 종료 대기 중 인터럽트 발생 시
     */
    public void shutdown() throws InterruptedException {
        workerExecutor.shutdown();
        if (!workerExecutor.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
            log.warn("Workers did not terminate within {}s, forcing shutdown", SHUTDOWN_TIMEOUT_SECONDS);
            workerExecutor.shutdownNow();
        }
        log.info("ParallelMapper shut down");
    }

    /**
     * {@link #shutdown()}과 같으며, 인터럽트되면 즉시 강제 종료하고 interrupt 플래그를 복원합니다.
     */
    @Override
    public void close() {
        try {
            shutdown();
        } catch (InterruptedException e) {
            workerExecutor.shutdownNow();
            Thread.currentThread().interrupt();
            log.warn("Interrupted while shutting down ParallelMapper, forced shutdown", e);
        }
    }
}
