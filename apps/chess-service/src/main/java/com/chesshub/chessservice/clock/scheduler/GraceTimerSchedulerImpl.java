package com.chesshub.chessservice.clock.scheduler;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * GraceTimerSchedulerImpl
 * ---------------------------------------
 * 基于 ScheduledThreadPoolExecutor 的单次计时实现。
 *
 * 职责：
 *  - 把延时任务投递到调度线程池，返回可取消的句柄；
 *  - 回调抛出的异常记录错误日志后不再向调度线程传播，保证线程池可继续服务其他对局。
 */
@Slf4j
public class GraceTimerSchedulerImpl implements GraceTimerScheduler {

    private final ScheduledThreadPoolExecutor scheduler;

    public GraceTimerSchedulerImpl(ScheduledThreadPoolExecutor scheduler) {
        this.scheduler = scheduler;
    }

    @Override
    public TimerHandle schedule(String key, Duration delay, Runnable task) {
        ScheduledFuture<?> fut = scheduler.schedule(() -> runSafely(key, task),
                delay.toMillis(), TimeUnit.MILLISECONDS);
        log.debug("timer scheduled: key={}, delayMs={}", key, delay.toMillis());
        return new FutureHandle(fut);
    }

    private void runSafely(String key, Runnable task) {
        try {
            task.run();
        } catch (RuntimeException e) {
            log.error("timer task failed: key={}", key, e);
        }
    }

    private record FutureHandle(ScheduledFuture<?> future) implements TimerHandle {
        @Override
        public boolean cancel() {
            return future.cancel(false);
        }

        @Override
        public boolean isDone() {
            return future.isDone();
        }
    }
}
