package com.sparta.cinema.common.exception;

/**
 * 분산 락을 대기 시간 안에 획득하지 못했을 때 발생하는 예외
 */
public class LockAcquisitionException extends BusinessException {
    public LockAcquisitionException(String lockKey) {
        super(ErrorCode.COMMON003, "다른 요청이 처리 중입니다. 잠시 후 다시 시도해주세요: " + lockKey);
    }
}
