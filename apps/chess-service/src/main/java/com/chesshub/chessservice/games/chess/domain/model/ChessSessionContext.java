package com.chesshub.chessservice.games.chess.domain.model;

import com.chesshub.chessservice.clock.scheduler.GraceTimerScheduler;
import com.chesshub.chessservice.games.chess.domain.repository.GameRecordRepository;
import com.chesshub.chessservice.games.chess.domain.repository.MoveRepository;
import com.chesshub.chessservice.games.chess.domain.repository.PlayerRepository;
import com.chesshub.chessservice.games.chess.domain.rule.RulesEngine;

import java.time.Duration;

/**
 * 对局运行所需的外部协作者（规则引擎、持久化网关、计时器）与掉线宽限期。
 * 由注册表统一构造，所有对局共享同一份。
 */
public record ChessSessionContext(RulesEngine rules,
                                  PlayerRepository players,
                                  GameRecordRepository games,
                                  MoveRepository moves,
                                  GraceTimerScheduler timers,
                                  Duration gracePeriod) {
}
