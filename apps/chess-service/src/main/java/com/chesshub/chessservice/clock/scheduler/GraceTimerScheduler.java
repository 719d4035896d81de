package com.chesshub.chessservice.clock.scheduler;

import java.time.Duration;

/**
 * GraceTimerScheduler
 * ---------------------------------------
 * 通用的“单次延时任务”调度接口，不关心掉线判负、对局回收等业务细节。
 *
 * 约定：
 *  - 每次 schedule 返回独立句柄，持有方可随时取消；
 *  - 对已执行或已取消的句柄再次 cancel 是安全的空操作；
 *  - 任务执行时不做任何有效性校验，由上层在回调里自行复核。
 */
public interface GraceTimerScheduler {

    /**
     * 计时句柄
     */
    interface TimerHandle {
        /**
         * 取消计时（不打断正在执行的回调）
         * @return true 表示本次调用真正取消了尚未执行的任务
         */
        boolean cancel();

        /** 已执行完毕或已取消 */
        boolean isDone();
    }

    /**
     * 在 delay 之后执行一次 task。
     * @param key   业务键（仅用于日志，如 "grace:{sessionId}:{playerId}"）
     * @param delay 延时
     * @param task  到期回调
     * @return 计时句柄
     */
    TimerHandle schedule(String key, Duration delay, Runnable task);
}
