package com.ryuqq.fsmkit.core.guard;

import java.util.List;
import java.util.function.Predicate;

/**
 * 자주 쓰이는 {@link Guard} 구현 모음.
 *
 * <p><strong>제공 가드:</strong></p>
 * <ul>
 *   <li>{@link #allowAll()}: 항상 허용</li>
 *   <li>{@link #denyAll(String)}: 항상 거부</li>
 *   <li>{@link #when(Predicate, String)}: 조건이 참이면 허용, 거짓이면 거부</li>
 *   <li>{@link #allOf(Guard...)}: 선언 순서대로 평가, 첫 번째 비허용 결정을 반환</li>
 * </ul>
 *
 * @author FsmKit Team
 * @since 1.0.0
 */
public final class Guards {

    private static final Guard ALLOW_ALL = context -> GuardDecision.allow();

    // Utility class - prevent instantiation
    private Guards() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 항상 허용하는 가드.
     *
     * @return Guard
     */
    public static Guard allowAll() {
        return ALLOW_ALL;
    }

    /**
     * 항상 거부하는 가드.
     *
     * @param reason 거부 사유
     * @return Guard
     */
    public static Guard denyAll(String reason) {
        GuardDecision denied = GuardDecision.deny(reason);
        return context -> denied;
    }

    /**
     * 조건 기반 가드.
     *
     * <p>predicate가 예외를 던지면 {@link GuardDecision.Fail}로 변환합니다.</p>
     *
     * @param predicate 허용 조건 (순수 함수여야 함)
     * @param denialReason 조건 불만족 시 거부 사유
     * @return Guard
     * @throws IllegalArgumentException predicate가 null인 경우
     */
    public static Guard when(Predicate<GuardContext> predicate, String denialReason) {
        if (predicate == null) {
            throw new IllegalArgumentException("predicate cannot be null");
        }
        GuardDecision denied = GuardDecision.deny(denialReason);
        return context -> {
            try {
                return predicate.test(context) ? GuardDecision.allow() : denied;
            } catch (RuntimeException e) {
                return GuardDecision.fail(e);
            }
        };
    }

    /**
     * 복합 가드.
     *
     * <p>모든 가드가 허용해야 허용합니다. 선언 순서대로 평가하며,
     * 첫 번째 Deny 또는 Fail에서 즉시 중단합니다.</p>
     *
     * @param guards 구성 가드 (1개 이상)
     * @return Guard
     * @throws IllegalArgumentException guards가 비어 있거나 null 요소가 있는 경우
     */
    public static Guard allOf(Guard... guards) {
        if (guards == null || guards.length == 0) {
            throw new IllegalArgumentException("guards cannot be empty");
        }
        for (Guard guard : guards) {
            if (guard == null) {
                throw new IllegalArgumentException("guards cannot contain null");
            }
        }
        List<Guard> ordered = List.of(guards);
        return context -> {
            for (Guard guard : ordered) {
                GuardDecision decision = guard.check(context);
                if (decision == null || !decision.isAllowed()) {
                    return decision;
                }
            }
            return GuardDecision.allow();
        };
    }
}
