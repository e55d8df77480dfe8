package com.ryuqq.controlplane.core.store;

import com.ryuqq.controlplane.core.error.ControlPlaneException;
import com.ryuqq.controlplane.core.error.ErrorKind;
import com.ryuqq.controlplane.core.model.AuditLog;
import com.ryuqq.controlplane.core.model.User;
import com.ryuqq.controlplane.core.state.EntityCollection;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * StateStore 단위 테스트.
 *
 * <ul>
 *   <li>동시 트랜잭션 직렬화 (lost update 없음)</li>
 *   <li>FIFO 순서</li>
 *   <li>본문 예외 시 저장 안 함 + 큐 계속 진행</li>
 *   <li>scope 로드 분기</li>
 * </ul>
 */
class StateStoreTest {

    private RecordingBackingStore backingStore;
    private StateStore stateStore;

    @BeforeEach
    void setUp() {
        backingStore = new RecordingBackingStore(false);
        stateStore = new StateStore(backingStore);
    }

    @AfterEach
    void tearDown() {
        stateStore.close();
    }

    // ============================================================
    // 1. 직렬화
    // ============================================================

    @Test
    void 동시에_N개_트랜잭션이_감사로그를_추가해도_유실되지_않음() throws Exception {
        // given
        int threads = 8;
        int perThread = 25;
        ExecutorService callers = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<CompletableFuture<Void>> futures = new ArrayList<>();

        // when
        for (int t = 0; t < threads; t++) {
            futures.add(CompletableFuture.runAsync(() -> {
                awaitQuietly(start);
                for (int i = 0; i < perThread; i++) {
                    stateStore.transact(draft -> {
                        AuditLog entry = new AuditLog();
                        entry.setId("audit-" + draft.getAuditLogs().size());
                        entry.setAction("counter.incremented");
                        draft.getAuditLogs().add(entry);
                        return null;
                    });
                }
            }, callers));
        }
        start.countDown();
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).get(30, TimeUnit.SECONDS);
        callers.shutdown();

        // then
        assertThat(backingStore.snapshot().getAuditLogs()).hasSize(threads * perThread);
        assertThat(backingStore.snapshot().getAuditLogs().get(threads * perThread - 1).getId())
            .isEqualTo("audit-" + (threads * perThread - 1));
    }

    @Test
    void submit된_트랜잭션은_FIFO_순서로_실행됨() {
        // given
        List<Integer> order = Collections.synchronizedList(new ArrayList<>());
        List<CompletableFuture<Integer>> futures = new ArrayList<>();

        // when
        for (int i = 0; i < 20; i++) {
            int index = i;
            futures.add(stateStore.submit(EntityCollection.all(), draft -> {
                order.add(index);
                return index;
            }));
        }
        futures.forEach(CompletableFuture::join);

        // then
        assertThat(order).containsExactlyElementsOf(
            java.util.stream.IntStream.range(0, 20).boxed().toList()
        );
    }

    // ============================================================
    // 2. 실패 처리
    // ============================================================

    @Test
    void 본문이_예외를_던지면_저장하지_않고_예외를_그대로_전달함() {
        // when & then
        assertThatThrownBy(() -> stateStore.transact(draft -> {
            User user = new User();
            user.setId("usr_1");
            draft.getUsers().add(user);
            throw ControlPlaneException.conflict("boom");
        }))
            .isInstanceOf(ControlPlaneException.class)
            .satisfies(e -> assertThat(((ControlPlaneException) e).kind()).isEqualTo(ErrorKind.CONFLICT));

        assertThat(backingStore.saves).isZero();
        assertThat(backingStore.snapshot().getUsers()).isEmpty();
    }

    @Test
    void 실패한_트랜잭션_이후에도_큐는_계속_진행됨() {
        // given
        CompletableFuture<Object> failed = stateStore.submit(EntityCollection.all(), draft -> {
            throw new IllegalStateException("first fails");
        });

        // when
        Integer users = stateStore.transact(draft -> {
            User user = new User();
            user.setId("usr_2");
            draft.getUsers().add(user);
            return draft.getUsers().size();
        });

        // then
        assertThat(failed).isCompletedExceptionally();
        assertThat(users).isEqualTo(1);
        assertThat(backingStore.snapshot().getUsers()).extracting(User::getId).containsExactly("usr_2");
    }

    @Test
    void 트랜잭션_본문에서_다시_트랜잭션을_열면_IllegalStateException() {
        assertThatThrownBy(() -> stateStore.transact(draft -> stateStore.transact(inner -> 1)))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("Nested transaction");
    }

    @Test
    void draft_수정은_커밋_전까지_저장소에_보이지_않음() {
        // when
        stateStore.transact(draft -> {
            User user = new User();
            user.setId("usr_3");
            draft.getUsers().add(user);
            assertThat(backingStore.snapshot().getUsers()).isEmpty();
            return null;
        });

        // then
        assertThat(backingStore.snapshot().getUsers()).hasSize(1);
    }

    // ============================================================
    // 3. scope 로드
    // ============================================================

    @Test
    void scope_로드를_지원하지_않으면_전체_로드_후_전체_저장() {
        // when
        stateStore.transactCollections(EntityCollection.scope(EntityCollection.USERS), draft -> null);

        // then
        assertThat(backingStore.loads).isEqualTo(1);
        assertThat(backingStore.scopedLoads).isZero();
        assertThat(backingStore.savedScopes.get(0)).isEqualTo(EntityCollection.all());
    }

    @Test
    void scope_로드를_지원하면_지정한_컬렉션만_로드하고_저장함() {
        // given
        RecordingBackingStore scopedStore = new RecordingBackingStore(true);
        try (StateStore scoped = new StateStore(scopedStore)) {

            // when
            scoped.transactCollections(EntityCollection.scope(EntityCollection.AUDIT_LOGS), draft -> {
                AuditLog entry = new AuditLog();
                entry.setId("audit_1");
                draft.getAuditLogs().add(entry);
                return null;
            });

            // then
            assertThat(scopedStore.scopedLoads).isEqualTo(1);
            assertThat(scopedStore.loads).isZero();
            assertThat(scopedStore.savedScopes.get(0)).containsExactly(EntityCollection.AUDIT_LOGS);
            assertThat(scopedStore.snapshot().getAuditLogs()).hasSize(1);
        }
    }

    @Test
    void 생성자에_null을_전달하면_IllegalArgumentException() {
        assertThatThrownBy(() -> new StateStore(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("backingStore cannot be null");
    }

    @Test
    void 빈_scope는_허용되지_않음() {
        assertThatThrownBy(() -> stateStore.transactCollections(java.util.Set.of(), draft -> null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            latch.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }
}
