package com.tasksync.command.idempotency;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tasksync.command.domain.CommandResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Redis-backed idempotency keys for commands.
 *
 * Key format:  idempotency:command:{tenantId}:{key}
 * Value:       "PENDING" while the command runs, then the JSON command result
 * TTL:         short while pending (a crashed request frees its key), 24 hours once complete
 *
 * SET NX is atomic: of two requests racing with the same key exactly one claims it.
 */
@Slf4j
@Service
public class RedisCommandIdempotencyStore implements CommandIdempotencyStore {

    private static final String KEY_PREFIX = "idempotency:command:";
    private static final String PENDING = "PENDING";

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final Duration pendingTtl;
    private final Duration resultTtl;

    public RedisCommandIdempotencyStore(StringRedisTemplate redisTemplate,
                                        ObjectMapper objectMapper,
                                        @Value("${tasksync.idempotency.pending-ttl:PT1M}") Duration pendingTtl,
                                        @Value("${tasksync.idempotency.ttl:PT24H}") Duration resultTtl) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.pendingTtl = pendingTtl;
        this.resultTtl = resultTtl;
    }

    @Override
    public IdempotencyClaim claim(String tenantId, String key) {
        String redisKey = redisKey(tenantId, key);
        Boolean isNew = redisTemplate.opsForValue().setIfAbsent(redisKey, PENDING, pendingTtl);
        if (Boolean.TRUE.equals(isNew)) {
            return IdempotencyClaim.claimed();
        }

        String stored = redisTemplate.opsForValue().get(redisKey);
        if (stored == null) {
            // expired between SET NX and GET: try once more
            return Boolean.TRUE.equals(redisTemplate.opsForValue().setIfAbsent(redisKey, PENDING, pendingTtl))
                    ? IdempotencyClaim.claimed()
                    : IdempotencyClaim.inProgress();
        }
        if (PENDING.equals(stored)) {
            return IdempotencyClaim.inProgress();
        }
        try {
            CommandResult result = objectMapper.readValue(stored, CommandResult.class);
            log.debug("Idempotent replay: tenantId={}, key={}, taskId={}", tenantId, key, result.getTaskId());
            return IdempotencyClaim.completed(result);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unreadable idempotency record: " + redisKey, e);
        }
    }

    @Override
    public void complete(String tenantId, String key, CommandResult result) {
        try {
            redisTemplate.opsForValue().set(redisKey(tenantId, key), objectMapper.writeValueAsString(result), resultTtl);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize command result for key " + key, e);
        }
    }

    @Override
    public void release(String tenantId, String key) {
        redisTemplate.delete(redisKey(tenantId, key));
    }

    private static String redisKey(String tenantId, String key) {
        return KEY_PREFIX + tenantId + ":" + key;
    }
}
