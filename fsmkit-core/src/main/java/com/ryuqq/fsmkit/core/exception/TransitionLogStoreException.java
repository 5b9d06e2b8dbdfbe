package com.ryuqq.fsmkit.core.exception;

/**
 * TransitionLogStore 구현체가 보고하는 저장소 오류.
 *
 * <p>항상 {@link ErrorKind#STORAGE}로 분류됩니다.</p>
 *
 * @author FsmKit Team
 * @since 1.0.0
 */
public class TransitionLogStoreException extends FsmException {

    private static final long serialVersionUID = 1L;

    /**
     * 메시지로 생성.
     *
     * @param message 오류 메시지
     */
    public TransitionLogStoreException(String message) {
        super(ErrorKind.STORAGE, message);
    }

    /**
     * 메시지와 원인으로 생성.
     *
     * @param message 오류 메시지
     * @param cause 원인 (예: JDBC, Redis 클라이언트 예외)
     */
    public TransitionLogStoreException(String message, Throwable cause) {
        super(ErrorKind.STORAGE, message, cause);
    }
}
