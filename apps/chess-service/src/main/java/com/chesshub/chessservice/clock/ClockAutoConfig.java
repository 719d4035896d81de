package com.chesshub.chessservice.clock;

import com.chesshub.chessservice.clock.scheduler.GraceTimerScheduler;
import com.chesshub.chessservice.clock.scheduler.GraceTimerSchedulerImpl;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ScheduledThreadPoolExecutor;

/**
 * ClockAutoConfig
 * ---------------------------------------
 * 计时相关 Bean 的装配：把调度线程池注入到通用单次计时器中。
 * 线程池由 {@link ClockSchedulerConfig} 提供，这里不关心任何业务细节。
 */
@Configuration
public class ClockAutoConfig {

    @Bean
    public GraceTimerScheduler graceTimerScheduler(
            @Qualifier("graceClockScheduler") ScheduledThreadPoolExecutor graceClockScheduler) {
        return new GraceTimerSchedulerImpl(graceClockScheduler);
    }
}
