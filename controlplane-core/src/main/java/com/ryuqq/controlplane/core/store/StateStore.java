package com.ryuqq.controlplane.core.store;

import com.ryuqq.controlplane.core.spi.BackingStore;
import com.ryuqq.controlplane.core.state.EntityCollection;
import com.ryuqq.controlplane.core.state.StateDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * 직렬화된 단일 writer 상태 트랜잭션 엔진.
 *
 * <p>모든 도메인 연산은 이 엔진의 트랜잭션 안에서 실행됩니다.</p>
 *
 * <p><strong>트랜잭션 흐름:</strong></p>
 * <pre>
 * 1. load() 또는 loadCollections(scope) → current
 * 2. current.deepCopy()                → draft (트랜잭션 전용)
 * 3. work.apply(draft)                 → result
 * 4. save(draft, current, scope)       → 커밋
 * </pre>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>인스턴스당 동시에 하나의 트랜잭션만 실행 (단일 스레드 executor, FIFO)</li>
 *   <li>본문이 예외를 던지면 아무것도 저장하지 않고 다음 트랜잭션으로 진행</li>
 *   <li>본문 안에서 다시 트랜잭션을 열면 {@link IllegalStateException}</li>
 *   <li>scope 로드 지원 여부는 생성 시 한 번만 확인</li>
 * </ul>
 *
 * @author Control Plane Team
 * @since 1.0.0
 */
public final class StateStore implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(StateStore.class);

    private final BackingStore backingStore;
    private final boolean scopedLoad;
    private final ExecutorService writer;
    private volatile Thread writerThread;

    /**
     * 생성자.
     *
     * @param backingStore 백엔드 저장소
     * @throws IllegalArgumentException backingStore가 null인 경우
     */
    public StateStore(BackingStore backingStore) {
        if (backingStore == null) {
            throw new IllegalArgumentException("backingStore cannot be null");
        }
        this.backingStore = backingStore;
        this.scopedLoad = backingStore.supportsScopedLoad();
        this.writer = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "state-store-writer");
            thread.setDaemon(true);
            writerThread = thread;
            return thread;
        });
        log.debug("StateStore created over {} (scopedLoad={})", backingStore.getClass().getSimpleName(), scopedLoad);
    }

    /**
     * 전체 상태에 대한 트랜잭션을 실행하고 결과를 기다립니다.
     *
     * @param work 트랜잭션 본문
     * @param <T> 결과 타입
     * @return 본문의 반환값
     * @throws RuntimeException 본문 또는 저장소가 던진 예외 (감싸지 않고 그대로)
     */
    public <T> T transact(TransactionWork<T> work) {
        return await(submit(EntityCollection.all(), work));
    }

    /**
     * 일부 컬렉션에 대한 트랜잭션을 실행하고 결과를 기다립니다.
     *
     * <p>백엔드가 scope 로드를 지원하지 않으면 전체 상태로 실행됩니다.
     * 본문은 scope 밖의 컬렉션을 수정하면 안 됩니다.</p>
     *
     * @param collections 사용할 컬렉션
     * @param work 트랜잭션 본문
     * @param <T> 결과 타입
     * @return 본문의 반환값
     */
    public <T> T transactCollections(Set<EntityCollection> collections, TransactionWork<T> work) {
        return await(submit(collections, work));
    }

    /**
     * 트랜잭션을 큐에 넣고 결과 Future를 반환합니다.
     *
     * @param collections 사용할 컬렉션
     * @param work 트랜잭션 본문
     * @param <T> 결과 타입
     * @return 커밋 후 결과로 완료되는 Future
     * @throws IllegalArgumentException 인자가 null이거나 scope가 비어 있는 경우
     * @throws IllegalStateException 트랜잭션 본문 안에서 호출한 경우
     */
    public <T> CompletableFuture<T> submit(Set<EntityCollection> collections, TransactionWork<T> work) {
        if (work == null) {
            throw new IllegalArgumentException("work cannot be null");
        }
        if (collections == null || collections.isEmpty()) {
            throw new IllegalArgumentException("collections cannot be null or empty");
        }
        if (Thread.currentThread() == writerThread) {
            throw new IllegalStateException("Nested transaction is not allowed inside a transaction body");
        }
        Set<EntityCollection> scope = Set.copyOf(collections);
        return CompletableFuture.supplyAsync(() -> run(scope, work), writer);
    }

    private <T> T run(Set<EntityCollection> scope, TransactionWork<T> work) {
        boolean scoped = scopedLoad && scope.size() < EntityCollection.all().size();
        StateDocument current = scoped ? backingStore.loadCollections(scope) : backingStore.load();
        StateDocument draft = current.deepCopy();

        T result = work.apply(draft);

        backingStore.save(draft, current, scoped ? scope : EntityCollection.all());
        return result;
    }

    private static <T> T await(CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw e;
        }
    }

    /**
     * writer 종료.
     *
     * <p>이미 큐에 들어간 트랜잭션은 완료될 때까지 대기합니다.</p>
     */
    @Override
    public void close() {
        writer.shutdown();
        try {
            if (!writer.awaitTermination(30, TimeUnit.SECONDS)) {
                log.warn("StateStore writer did not terminate in time, forcing shutdown");
                writer.shutdownNow();
            }
        } catch (InterruptedException e) {
            writer.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
