package com.sparta.cinema.infrastructure.aop;

import com.sparta.cinema.common.exception.LockAcquisitionException;
import com.sparta.cinema.common.util.CustomSpringELParser;
import com.sparta.cinema.infrastructure.aop.annotation.DistributedLock;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.reflect.MethodSignature;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * 분산 락 AOP
 *
 * 실행 순서: 락 획득 → 트랜잭션 시작 → 비즈니스 로직 → 커밋 → 락 해제
 * - 트랜잭션은 락이 걸린 UseCase가 호출하는 Service의 @Transactional이 관리한다
 * - 락은 커밋 이후 finally 블록에서 해제되므로 다음 요청은 항상 커밋된 데이터를 본다
 */
@Slf4j
@Aspect
@Component
@RequiredArgsConstructor
@Order(Ordered.HIGHEST_PRECEDENCE)
public class DistributedLockAop {

    private static final String REDISSON_LOCK_PREFIX = "lock:";

    private final RedissonClient redissonClient;

    @Around("@annotation(distributedLock)")
    public Object lock(final ProceedingJoinPoint joinPoint, DistributedLock distributedLock) throws Throwable {
        MethodSignature signature = (MethodSignature) joinPoint.getSignature();
        String key = REDISSON_LOCK_PREFIX + CustomSpringELParser.getDynamicValue(
                signature.getParameterNames(),
                joinPoint.getArgs(),
                distributedLock.key()
        );

        RLock rLock = redissonClient.getLock(key);
        boolean available;
        try {
            available = rLock.tryLock(
                    distributedLock.waitTime(),
                    distributedLock.leaseTime(),
                    distributedLock.timeUnit()
            );
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LockAcquisitionException(key);
        }

        if (!available) {
            log.warn("[DistributedLock] 락 획득 실패 - key: {}", key);
            throw new LockAcquisitionException(key);
        }

        log.debug("[DistributedLock] 락 획득 - key: {}", key);
        try {
            return joinPoint.proceed();
        } finally {
            try {
                rLock.unlock();
                log.debug("[DistributedLock] 락 해제 - key: {}", key);
            } catch (IllegalMonitorStateException e) {
                log.warn("[DistributedLock] 이미 해제된 락 - key: {}, method: {}",
                        key, signature.getMethod().getName());
            }
        }
    }
}
