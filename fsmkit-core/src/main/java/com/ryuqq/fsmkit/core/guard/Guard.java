package com.ryuqq.fsmkit.core.guard;

/**
 * 전이 허용 여부를 결정하는 가드.
 *
 * <p><strong>구현 규칙:</strong></p>
 * <ul>
 *   <li>순수 함수: {@link GuardContext}만으로 결정 (현재 시각, 외부 상태 조회 금지)</li>
 *   <li>같은 context에 대해 항상 같은 {@link GuardDecision} 반환</li>
 *   <li>도메인 거부는 {@link GuardDecision#deny(String)}, 예상치 못한 오류는
 *       {@link GuardDecision#fail(Throwable)}로 표현</li>
 * </ul>
 *
 * <p>이 순수성 덕분에 멱등성 재생 시 가드를 다시 평가하지 않아도 안전합니다.
 * 가드가 RuntimeException을 던지면 머신은 이를 Fail로 취급합니다.</p>
 *
 * <p><strong>구현 예시:</strong></p>
 * <pre>
 * Guard signaturesValid = ctx -&gt; ctx.input() instanceof Transfer t &amp;&amp; t.signed()
 *     ? GuardDecision.allow()
 *     : GuardDecision.deny("signatures_invalid");
 * </pre>
 *
 * @author FsmKit Team
 * @since 1.0.0
 * @see Guards
 */
@FunctionalInterface
public interface Guard {

    /**
     * 전이 허용 여부 평가.
     *
     * @param context 평가 스냅샷
     * @return Allow, Deny(reason), Fail(cause) 중 하나 (null 반환 금지)
     */
    GuardDecision check(GuardContext context);
}
