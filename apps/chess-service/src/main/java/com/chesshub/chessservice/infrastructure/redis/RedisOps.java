package com.chesshub.chessservice.infrastructure.redis;

import lombok.RequiredArgsConstructor;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 公用 Redis 工具类：
 * - 封装常用 String/Hash/Set/ZSet 操作
 * - 仅提供“原语级”方法；业务键名与字段名放在 Repo 层组织
 * - 对象值走 JSON 模板，计数/索引走字符串模板（保证 HINCRBY 可用）
 */
@Component
@RequiredArgsConstructor
public class RedisOps {
    /** 通用对象模板：用于 JSON 存储与反序列化 */
    private final RedisTemplate<String, Object> redis;
    /** 字符串模板：用于计数、索引等轻量操作 */
    private final StringRedisTemplate strRedis;

    // -------------- Object --------------
    /**
     * 写入键值（无 TTL）
     */
    public boolean set(String key, Object val) {
        redis.opsForValue().set(key, val);
        return true;
    }

    /**
     * 获取键值并自动反序列化为指定类型
     */
    @SuppressWarnings("unchecked")
    public <T> T get(String key, Class<T> type) {
        Object v = redis.opsForValue().get(key);
        return (v == null) ? null : (T) v;
    }

    // -------------- Hash（对象） --------------
    /**
     * 写入 Hash 字段（值走 JSON 模板）
     */
    public boolean hSet(String key, String field, Object val) {
        redis.opsForHash().put(key, field, val);
        return true;
    }

    /**
     * 读取 Hash 全部字段值并转换为指定类型（顺序不保证）
     */
    @SuppressWarnings("unchecked")
    public <T> List<T> hValues(String key, Class<T> type) {
        List<Object> raw = redis.opsForHash().values(key);
        if (raw == null || raw.isEmpty()) return Collections.emptyList();
        List<T> out = new ArrayList<>(raw.size());
        for (Object v : raw) {
            if (v != null) out.add((T) v);
        }
        return out;
    }

    /**
     * 删除指定 Hash 字段
     */
    public Long hDel(String key, String... fields) {
        return redis.opsForHash().delete(key, (Object[]) fields);
    }

    // -------------- Hash（字符串） --------------
    /**
     * 批量写入 Hash（字段值均为字符串）
     */
    public boolean hSetAll(String key, Map<String, String> map) {
        strRedis.opsForHash().putAll(key, map);
        return true;
    }

    /**
     * 获取整个 Hash（转为 Map<String,String>）
     */
    public Map<String, String> hGetAll(String key) {
        Map<Object, Object> raw = strRedis.opsForHash().entries(key);
        Map<String, String> out = new HashMap<>();
        raw.forEach((k, v) -> out.put(String.valueOf(k), String.valueOf(v)));
        return out;
    }

    /**
     * Hash 字段自增（整数）
     */
    public Long hIncrBy(String key, String field, long delta) {
        return strRedis.opsForHash().increment(key, field, delta);
    }

    // -------------- Set --------------
    public Long sAdd(String key, String... members) {
        return strRedis.opsForSet().add(key, members);
    }

    /**
     * 将成员从一个集合原子地移到另一个集合（状态索引迁移）
     */
    public Boolean sMove(String source, String member, String dest) {
        return strRedis.opsForSet().move(source, member, dest);
    }

    public long sCard(String key) {
        Long n = strRedis.opsForSet().size(key);
        return n == null ? 0L : n;
    }

    // -------------- ZSet --------------
    public Boolean zAdd(String key, String member, double score) {
        return strRedis.opsForZSet().add(key, member, score);
    }

    /**
     * 按分数倒序取前 limit 个成员
     */
    public Set<String> zRevRange(String key, int limit) {
        Set<String> members = strRedis.opsForZSet().reverseRange(key, 0, limit - 1L);
        return members == null ? Collections.emptySet() : new LinkedHashSet<>(members);
    }
}
