package com.ryuqq.fsmkit.core.exception;

import java.util.Optional;

/**
 * FsmKit 공통 checked 예외.
 *
 * <p>모든 실패는 {@link ErrorKind}로 분류되며, 호출자는 메시지 문자열이 아닌
 * {@link #kind()} 또는 {@link #is(ErrorKind)}로 분기해야 합니다.</p>
 *
 * <p><strong>가드 거부 vs 가드 실패:</strong></p>
 * <ul>
 *   <li>결정적 거부: kind = ILLEGAL_TRANSITION, {@link #denialReason()} 존재, cause 없음</li>
 *   <li>내부 실패: kind = ILLEGAL_TRANSITION, {@link #getCause()}로 원본 오류 확인 가능</li>
 * </ul>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * TransitionResult result = machine.next("tx-1", from, on, at, meta, input);
 * if (result.errorOptional().map(e -&gt; e.is(ErrorKind.NO_TRANSITION)).orElse(false)) {
 *     // 규칙 없음
 * }
 * </pre>
 *
 * @author FsmKit Team
 * @since 1.0.0
 */
public class FsmException extends Exception {

    private static final long serialVersionUID = 1L;

    private final ErrorKind kind;
    private final String denialReason;

    /**
     * 기본 메시지로 예외 생성.
     *
     * @param kind 오류 분류
     * @throws IllegalArgumentException kind가 null인 경우
     */
    public FsmException(ErrorKind kind) {
        this(kind, requireKind(kind).description(), null, null);
    }

    /**
     * 상세 메시지로 예외 생성.
     *
     * @param kind 오류 분류
     * @param message 상세 메시지
     * @throws IllegalArgumentException kind가 null인 경우
     */
    public FsmException(ErrorKind kind, String message) {
        this(kind, message, null, null);
    }

    /**
     * 원인 예외를 포함하여 생성.
     *
     * @param kind 오류 분류
     * @param message 상세 메시지
     * @param cause 원인 (null 가능)
     * @throws IllegalArgumentException kind가 null인 경우
     */
    public FsmException(ErrorKind kind, String message, Throwable cause) {
        this(kind, message, cause, null);
    }

    private FsmException(ErrorKind kind, String message, Throwable cause, String denialReason) {
        super(message, cause);
        this.kind = requireKind(kind);
        this.denialReason = denialReason;
    }

    /**
     * 가드의 결정적 거부를 나타내는 예외 생성.
     *
     * @param reason 거부 사유 (빈 문자열 허용)
     * @return ILLEGAL_TRANSITION 예외
     */
    public static FsmException guardBlocked(String reason) {
        String r = reason == null ? "" : reason;
        String message = r.isEmpty() ? "illegal transition: guard blocked" : "illegal transition: guard blocked: " + r;
        return new FsmException(ErrorKind.ILLEGAL_TRANSITION, message, null, r);
    }

    /**
     * 가드 내부 실패를 나타내는 예외 생성.
     *
     * @param cause 가드가 보고한 원본 오류
     * @return ILLEGAL_TRANSITION 예외 (cause 포함)
     */
    public static FsmException guardFailed(Throwable cause) {
        return new FsmException(ErrorKind.ILLEGAL_TRANSITION,
            "illegal transition: guard failed: " + cause, cause, null);
    }

    /**
     * 오류 분류 조회.
     *
     * @return ErrorKind
     */
    public ErrorKind kind() {
        return kind;
    }

    /**
     * 오류 분류 비교.
     *
     * @param expected 기대 분류
     * @return 동일하면 true
     */
    public boolean is(ErrorKind expected) {
        return kind == expected;
    }

    /**
     * 가드의 결정적 거부 사유.
     *
     * @return 거부된 경우 사유, 그 외 empty
     */
    public Optional<String> denialReason() {
        return Optional.ofNullable(denialReason);
    }

    /**
     * 가드 거부로 인한 예외인지 확인.
     *
     * @return 결정적 거부이면 true
     */
    public boolean isGuardDenial() {
        return denialReason != null;
    }

    private static ErrorKind requireKind(ErrorKind kind) {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        return kind;
    }
}
