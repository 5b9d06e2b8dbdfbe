package com.ryuqq.fsmkit.core.exception;

/**
 * FsmKit 오류 분류.
 *
 * <p><strong>발생 시점:</strong></p>
 * <ul>
 *   <li>구성 시점 (즉시 throw): INVALID_MACHINE_NAME, INVALID_TRANSITION, DUPLICATE_TRANSITION,
 *       NIL_MACHINE, NIL_STORE, NIL_KEY_FUNCTION</li>
 *   <li>평가 시점 (TransitionLog와 함께 반환): INVALID_STATE, INVALID_EVENT, NO_TRANSITION,
 *       ILLEGAL_TRANSITION</li>
 *   <li>멱등성 래퍼: MISSING_IDEMPOTENCY_KEY, STORAGE</li>
 * </ul>
 *
 * @author FsmKit Team
 * @since 1.0.0
 */
public enum ErrorKind {

    INVALID_MACHINE_NAME("invalid machine name"),
    INVALID_STATE("invalid state"),
    INVALID_EVENT("invalid event"),
    INVALID_TRANSITION("invalid transition"),
    DUPLICATE_TRANSITION("duplicate transition for state+event"),
    NO_TRANSITION("no transition for state+event"),

    /**
     * 가드가 결정적으로 거부했거나, 가드 내부 오류가 발생한 경우.
     */
    ILLEGAL_TRANSITION("illegal transition"),

    MISSING_IDEMPOTENCY_KEY("missing idempotency key"),
    NIL_MACHINE("nil machine"),
    NIL_STORE("nil store"),
    NIL_KEY_FUNCTION("nil idempotency key function"),

    /**
     * 호출자가 제공한 TransitionLogStore가 실패를 보고한 경우.
     */
    STORAGE("transition log store failure");

    private final String description;

    ErrorKind(String description) {
        this.description = description;
    }

    /**
     * 기본 오류 메시지.
     *
     * @return 사람이 읽을 수 있는 설명
     */
    public String description() {
        return description;
    }
}
