package com.verticx.finance.fee;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Duration;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

/**
 * Redis-backed mutual exclusion for ledger mutations on a single entity.
 */
@Service
public class LedgerLockService {

    private static final Logger logger = LoggerFactory.getLogger(LedgerLockService.class);
    private static final long LOCK_WAIT_MILLIS = 100;
    private static final RedisScript<Long> RELEASE_SCRIPT = new DefaultRedisScript<>(
            "if redis.call('get', KEYS[1]) == ARGV[1] then return redis.call('del', KEYS[1]) else return 0 end",
            Long.class);

    private final StringRedisTemplate redisTemplate;
    private final int lockTimeoutSeconds;
    private final int maxRetries;

    public LedgerLockService(StringRedisTemplate redisTemplate,
                             @Value("${app.ledger.lock.timeoutSeconds:30}") int lockTimeoutSeconds,
                             @Value("${app.ledger.lock.maxRetries:3}") int maxRetries) {
        this.redisTemplate = redisTemplate;
        this.lockTimeoutSeconds = lockTimeoutSeconds;
        this.maxRetries = maxRetries;
    }

    public static String feeLedgerKey(Long studentId) {
        return "ledger:fee:" + studentId;
    }

    /**
     * Acquire the lock for a key
     * @param lockKey The key to lock
     * @return the owner token to release the lock with, or null if the lock is held elsewhere
     */
    public String acquireLock(String lockKey) {
        String lockToken = UUID.randomUUID().toString();
        Boolean acquired = redisTemplate.opsForValue()
                .setIfAbsent(lockKey, lockToken, Duration.ofSeconds(lockTimeoutSeconds));
        return Boolean.TRUE.equals(acquired) ? lockToken : null;
    }

    /**
     * Deletes the key only while it still holds {@code lockToken}; a lock that expired and was taken
     * by another holder is left alone.
     */
    public void releaseLock(String lockKey, String lockToken) {
        Long deleted = redisTemplate.execute(RELEASE_SCRIPT, List.of(lockKey), lockToken);
        if (deleted == null || deleted == 0L) {
            logger.warn("Ledger lock {} expired before release", lockKey);
        }
    }

    /**
     * Releases the lock once the surrounding transaction commits or rolls back. Outside a
     * transaction the lock is released immediately.
     */
    public void releaseAfterCompletion(String lockKey, String lockToken) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            releaseLock(lockKey, lockToken);
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCompletion(int status) {
                releaseLock(lockKey, lockToken);
            }
        });
    }

    /**
     * Try to acquire the lock, backing off linearly between attempts
     * @param lockKey The key to lock
     * @return the owner token, or null if every attempt failed
     */
    public String tryAcquireLockWithRetry(String lockKey) {
        for (int attempt = 0; attempt < maxRetries; attempt++) {
            String lockToken = acquireLock(lockKey);
            if (lockToken != null) {
                return lockToken;
            }

            if (attempt < maxRetries - 1) {
                try {
                    TimeUnit.MILLISECONDS.sleep(LOCK_WAIT_MILLIS * (attempt + 1));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return null;
                }
            }
        }
        logger.warn("Could not acquire ledger lock {} after {} attempts", lockKey, maxRetries);
        return null;
    }
}
