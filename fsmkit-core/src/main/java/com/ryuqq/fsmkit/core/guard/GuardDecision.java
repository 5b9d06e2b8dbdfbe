package com.ryuqq.fsmkit.core.guard;

/**
 * 가드 평가 결과.
 *
 * <p>GuardDecision은 세 가지 결과를 타입으로 구분합니다:</p>
 * <ul>
 *   <li>{@link Allow}: 전이 허용</li>
 *   <li>{@link Deny}: 도메인 규칙에 의한 결정적 거부 (사유 포함)</li>
 *   <li>{@link Fail}: 예상치 못한 가드 내부 오류 (원인 포함)</li>
 * </ul>
 *
 * <p>Deny와 Fail은 절대 혼동되어서는 안 됩니다. Deny는 같은 입력에 대해 항상 같은 결과이므로
 * 멱등성 재생 시 그대로 재사용할 수 있지만, Fail은 가드 구현의 결함을 의미합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Guard guard = ctx -&gt; "api".equals(ctx.meta().get("source"))
 *     ? GuardDecision.allow()
 *     : GuardDecision.deny("source_not_allowed");
 * </pre>
 *
 * @author FsmKit Team
 * @since 1.0.0
 */
public sealed interface GuardDecision permits GuardDecision.Allow, GuardDecision.Deny, GuardDecision.Fail {

    /**
     * 허용 결정.
     *
     * @return Allow 싱글톤
     */
    static GuardDecision allow() {
        return Allow.INSTANCE;
    }

    /**
     * 결정적 거부.
     *
     * @param reason 거부 사유 (null이면 빈 문자열)
     * @return Deny 인스턴스
     */
    static GuardDecision deny(String reason) {
        return new Deny(reason == null ? "" : reason);
    }

    /**
     * 내부 실패.
     *
     * @param cause 원인
     * @return Fail 인스턴스
     * @throws IllegalArgumentException cause가 null인 경우
     */
    static GuardDecision fail(Throwable cause) {
        return new Fail(cause);
    }

    /**
     * 허용 여부 확인.
     *
     * @return Allow이면 true
     */
    default boolean isAllowed() {
        return this instanceof Allow;
    }

    /**
     * 허용.
     */
    final class Allow implements GuardDecision {

        private static final Allow INSTANCE = new Allow();

        private Allow() {
        }

        @Override
        public String toString() {
            return "Allow";
        }
    }

    /**
     * 결정적 거부.
     *
     * @param reason 거부 사유 (빈 문자열 허용)
     */
    record Deny(String reason) implements GuardDecision {

        public Deny {
            if (reason == null) {
                throw new IllegalArgumentException("reason cannot be null");
            }
        }
    }

    /**
     * 가드 내부 실패.
     *
     * @param cause 원본 오류
     */
    record Fail(Throwable cause) implements GuardDecision {

        public Fail {
            if (cause == null) {
                throw new IllegalArgumentException("cause cannot be null");
            }
        }
    }
}
