package com.ryuqq.jobstore.application.job;

/**
 * 저장된 호출 정보를 실행 가능한 {@link Job}으로 복원하지 못한 경우.
 *
 * <p>타입이나 메서드가 사라졌거나 인자 JSON이 현재 타입과 맞지 않을 때 발생합니다.
 * {@link JobData}는 이 예외를 던지지 않고 보관합니다.</p>
 *
 * @author JobStore Team
 * @since 1.0.0
 */
public class InvocationDataException extends RuntimeException {

    public InvocationDataException(String message) {
        super(message);
    }

    public InvocationDataException(String message, Throwable cause) {
        super(message, cause);
    }
}
