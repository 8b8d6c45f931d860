package com.flagship.invoices.invoice.command;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Remembers the result of every executed command, keyed by command id.
 *
 * Strategy:
 * 1. Try Redis first (fast, but can be unavailable)
 * 2. Fall back to the command_results table (always written, source of truth)
 * 3. Re-populate Redis on a database hit
 *
 * Redis is written only after the command transaction commits, so a rolled back
 * command never leaves a cached result behind.
 */
@Service
@Slf4j
public class IdempotencyService {

    private static final String REDIS_KEY_PREFIX = "invoice-command:";

    private final CommandResultRepository repository;
    private final Optional<RedisTemplate<String, String>> redisTemplate;
    private final ObjectMapper objectMapper;
    private final Duration redisTtl;

    public IdempotencyService(CommandResultRepository repository,
                              Optional<RedisTemplate<String, String>> redisTemplate,
                              ObjectMapper objectMapper,
                              @Value("${idempotency.redis-ttl:P7D}") Duration redisTtl) {
        this.repository = repository;
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.redisTtl = redisTtl;
    }

    /**
     * @return the stored result if this command id was already executed
     */
    @Transactional(readOnly = true)
    public Optional<CommandResult> findResult(UUID commandId) {
        if (commandId == null) {
            throw new IllegalArgumentException("Command id cannot be null");
        }

        if (redisTemplate.isPresent()) {
            try {
                String cached = redisTemplate.get().opsForValue().get(redisKey(commandId));
                if (cached != null) {
                    log.debug("Command result found in Redis: {}", commandId);
                    return Optional.of(deserialize(cached));
                }
            } catch (Exception e) {
                log.warn("Redis lookup failed for command {}. Falling back to database. Error: {}",
                        commandId, e.getMessage());
            }
        }

        Optional<CommandResultEntity> stored = repository.findById(commandId);
        if (stored.isEmpty()) {
            return Optional.empty();
        }

        log.debug("Command result found in database: {}", commandId);
        cache(commandId, stored.get().getResult());
        return Optional.of(deserialize(stored.get().getResult()));
    }

    /**
     * Persists the result in the caller's transaction.
     *
     * @return the JSON that was stored
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public String storeResult(CommandResult result) {
        String json = serialize(result);
        repository.save(CommandResultEntity.of(result, json));
        log.debug("Stored result for command {} (succeeded={})", result.getCommandId(), result.succeeded());
        return json;
    }

    /**
     * Best effort; the database copy is authoritative.
     */
    public void cache(UUID commandId, String resultJson) {
        if (redisTemplate.isEmpty()) {
            return;
        }
        try {
            redisTemplate.get().opsForValue().set(redisKey(commandId), resultJson, redisTtl);
        } catch (Exception e) {
            log.warn("Failed to cache command result in Redis: {}. Error: {}", commandId, e.getMessage());
        }
    }

    private String redisKey(UUID commandId) {
        return REDIS_KEY_PREFIX + commandId;
    }

    private String serialize(CommandResult result) {
        try {
            return objectMapper.writeValueAsString(result);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize command result", e);
        }
    }

    private CommandResult deserialize(String json) {
        try {
            return objectMapper.readValue(json, CommandResult.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unreadable stored command result: " + e.getOriginalMessage(), e);
        }
    }
}
