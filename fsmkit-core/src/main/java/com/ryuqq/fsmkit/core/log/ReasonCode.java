package com.ryuqq.fsmkit.core.log;

/**
 * 평가 결과 사유 코드.
 *
 * <p>{@link #code()} 값은 정규 문자열({@code reason=<code>})에 그대로 기록되므로
 * 변경하면 기존에 저장된 로그와의 비교가 깨집니다.</p>
 *
 * @author FsmKit Team
 * @since 1.0.0
 */
public enum ReasonCode {

    /**
     * 전이 허용.
     */
    OK("ok"),

    /**
     * 상태 또는 이벤트 식별자가 유효하지 않음.
     */
    INVALID_INPUT("invalid_input"),

    /**
     * (state, event)에 등록된 전이 없음.
     */
    NO_TRANSITION("no_transition"),

    /**
     * 가드가 결정적으로 거부.
     */
    GUARD_BLOCKED("guard_blocked"),

    /**
     * 가드 내부 오류.
     */
    INTERNAL_ERROR("internal_error");

    private final String code;

    ReasonCode(String code) {
        this.code = code;
    }

    /**
     * 정규 문자열에 기록되는 코드.
     *
     * @return 코드 (예: ok, no_transition)
     */
    public String code() {
        return code;
    }

    /**
     * 코드 문자열로 ReasonCode 조회.
     *
     * @param code 코드 문자열
     * @return 일치하는 ReasonCode
     * @throws IllegalArgumentException 알 수 없는 코드인 경우
     */
    public static ReasonCode fromCode(String code) {
        for (ReasonCode reason : values()) {
            if (reason.code.equals(code)) {
                return reason;
            }
        }
        throw new IllegalArgumentException("Unknown reason code: " + code);
    }

    @Override
    public String toString() {
        return code;
    }
}
