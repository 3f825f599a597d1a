package com.ryuqq.bridge.adapter.runner;

import com.ryuqq.bridge.core.failure.FailureType;
import com.ryuqq.bridge.core.model.Request;
import com.ryuqq.bridge.core.model.Result;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * ExecutorBackendHandler 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class ExecutorBackendHandlerTest {

    private ExecutorBackendHandler handler;

    @AfterEach
    void tearDown() throws InterruptedException {
        if (handler != null) {
            handler.shutdown();
        }
    }

    @Test
    void 함수를_별도_스레드에서_실행() {
        // given
        String callerThread = Thread.currentThread().getName();
        handler = new ExecutorBackendHandler(
            request -> Result.success(Thread.currentThread().getName(), 1.0, Duration.ZERO, List.of("backend")),
            2
        );

        // when
        Result result = handler.handle(Request.of("where am I?")).join();

        // then
        assertThat(result.content()).isNotEqualTo(callerThread);
        assertThat(handler.getStatus()).isEqualTo(ExecutorBackendHandler.STATUS_READY);
        assertThat(handler.getMetrics()).containsEntry("invocations", 1L).containsEntry("failures", 0L);
    }

    @Test
    void 예외와_실패_결과를_실패로_집계() {
        // given
        handler = new ExecutorBackendHandler(request -> {
            if (request.content().equals("boom")) {
                throw new IllegalStateException("boom");
            }
            return Result.failure(FailureType.BACKEND_FAILURE, Duration.ZERO, List.of());
        }, 1);

        // when
        CompletableFuture<Result> thrown = handler.handle(Request.of("boom"));
        CompletableFuture<Result> failed = handler.handle(Request.of("fail"));

        // then
        assertThatThrownBy(thrown::join)
            .isInstanceOf(CompletionException.class)
            .hasCauseInstanceOf(IllegalStateException.class);
        assertThat(failed.join().success()).isFalse();
        assertThat(handler.getMetrics())
            .containsEntry("invocations", 2L)
            .containsEntry("failures", 2L)
            .containsEntry("abandoned", 0L);
    }

    @Test
    void 외부_타임아웃_시_작업_스레드를_인터럽트() throws InterruptedException {
        // given
        CountDownLatch interrupted = new CountDownLatch(1);
        handler = new ExecutorBackendHandler(request -> {
            try {
                Thread.sleep(10_000);
            } catch (InterruptedException e) {
                interrupted.countDown();
                Thread.currentThread().interrupt();
            }
            return Result.success("late", 1.0, Duration.ZERO, List.of("backend"));
        }, 1);

        // when
        CompletableFuture<Result> future = handler.handle(Request.of("slow"))
            .orTimeout(50, TimeUnit.MILLISECONDS);

        // then
        assertThatThrownBy(future::join).hasCauseInstanceOf(TimeoutException.class);
        assertThat(interrupted.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(handler.getMetrics()).containsEntry("abandoned", 1L);
    }

    @Test
    void 종료_후에는_stopped_상태이며_요청을_거부() throws InterruptedException {
        // given
        handler = new ExecutorBackendHandler(
            request -> Result.success("ok", 1.0, Duration.ZERO, List.of()),
            1
        );

        // when
        handler.shutdown();
        CompletableFuture<Result> future = handler.handle(Request.of("late"));

        // then
        assertThat(handler.getStatus()).isEqualTo(ExecutorBackendHandler.STATUS_STOPPED);
        assertThatThrownBy(future::join).hasCauseInstanceOf(RejectedExecutionException.class);
    }

    @Test
    void 생성자_검증() {
        assertThatThrownBy(() -> new ExecutorBackendHandler(null, 1))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ExecutorBackendHandler(request -> null, 0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("threads must be positive (current: 0)");
    }
}
