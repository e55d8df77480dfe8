package com.ryuqq.controlplane.adapter.runner;

import com.ryuqq.controlplane.adapter.inmemory.dispatch.InMemoryJobDispatcher;
import com.ryuqq.controlplane.application.template.TemplateService;
import com.ryuqq.controlplane.core.model.TemplateBuild;
import com.ryuqq.controlplane.core.statemachine.BuildStatus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * BuildQueueWorker 유닛 테스트.
 *
 * @author Control Plane Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class BuildQueueWorkerTest {

    @Mock
    private TemplateService templateService;

    private InMemoryJobDispatcher dispatcher;
    private BuildQueueWorker worker;

    @BeforeEach
    void setUp() {
        dispatcher = new InMemoryJobDispatcher();
        worker = new BuildQueueWorker(dispatcher, templateService, new BuildWorkerConfig().withBatchSize(2));
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        worker.shutdown();
    }

    // ============================================================
    // 1. pump: 배치 단위 처리
    // ============================================================

    @Test
    void pump_큐의_빌드를_처리_서비스에_전달함() {
        // given
        when(templateService.processTemplateBuildById("bld_1")).thenReturn(Optional.of(build("bld_1")));
        dispatcher.enqueueBuild("bld_1");

        // when
        int submitted = worker.pump();

        // then
        assertThat(submitted).isEqualTo(1);
        verify(templateService, timeout(2000)).processTemplateBuildById("bld_1");
    }

    @Test
    void pump_배치_크기만큼만_꺼냄() {
        // given
        when(templateService.processTemplateBuildById(anyString())).thenReturn(Optional.empty());
        dispatcher.enqueueBuild("bld_1");
        dispatcher.enqueueBuild("bld_2");
        dispatcher.enqueueBuild("bld_3");

        // when
        int submitted = worker.pump();

        // then
        assertThat(submitted).isEqualTo(2);
        assertThat(dispatcher.pendingBuilds()).isEqualTo(1);
        verify(templateService, timeout(2000)).processTemplateBuildById("bld_2");
    }

    @Test
    void pump_큐가_비어있으면_아무것도_하지_않음() {
        int submitted = worker.pump();

        assertThat(submitted).isZero();
        verify(templateService, never()).processTemplateBuildById(anyString());
    }

    // ============================================================
    // 2. 예외 처리: 실패해도 다음 빌드 계속 처리
    // ============================================================

    @Test
    void pump_처리_중_예외가_나도_다른_빌드는_처리됨() throws InterruptedException {
        // given
        when(templateService.processTemplateBuildById("bld_bad")).thenThrow(new IllegalStateException("boom"));
        when(templateService.processTemplateBuildById("bld_ok")).thenReturn(Optional.of(build("bld_ok")));
        dispatcher.enqueueBuild("bld_bad");
        dispatcher.enqueueBuild("bld_ok");

        // when
        worker.pump();
        worker.shutdown();

        // then
        assertThat(worker.failedCount()).isEqualTo(1);
        assertThat(worker.processedCount()).isEqualTo(1);
    }

    // ============================================================
    // 3. 설정 검증
    // ============================================================

    @Test
    void 설정_값이_양수가_아니면_예외() {
        assertThatThrownBy(() -> new BuildWorkerConfig(0, 10, 2))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("pollingIntervalMs");
        assertThatThrownBy(() -> new BuildWorkerConfig().withConcurrency(0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("concurrency");
    }

    @Test
    void 생성자_의존성이_null이면_예외() {
        assertThatThrownBy(() -> new BuildQueueWorker(null, templateService, new BuildWorkerConfig()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("dispatcher cannot be null");
    }

    private static TemplateBuild build(String id) {
        TemplateBuild build = new TemplateBuild();
        build.setId(id);
        build.setStatus(BuildStatus.SUCCEEDED);
        return build;
    }
}
