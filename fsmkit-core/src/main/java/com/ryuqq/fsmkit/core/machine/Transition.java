package com.ryuqq.fsmkit.core.machine;

import com.ryuqq.fsmkit.core.guard.Guard;
import com.ryuqq.fsmkit.core.model.Event;
import com.ryuqq.fsmkit.core.model.State;

import java.util.Optional;

/**
 * 전이 규칙 (from --on--&gt; to).
 *
 * <p>Transition은 불변이며, {@link Machine#register(Transition)} 시점에 정규화된 사본이 저장됩니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * Transition submit = Transition.of("PENDING", "SUBMIT", "SUBMITTED")
 *     .named("submit")
 *     .guardedBy(Guards.when(ctx -&gt; ctx.meta().containsKey("source"), "missing_source"));
 * </pre>
 *
 * @param from 시작 상태
 * @param on 이벤트
 * @param to 목표 상태
 * @param name 설명용 이름 (검증 없음, 공백 제거만 수행)
 * @param guard 가드 (null이면 가드 없음)
 *
 * @author FsmKit Team
 * @since 1.0.0
 */
public record Transition(
    State from,
    Event on,
    State to,
    String name,
    Guard guard
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException from, on, to가 null인 경우
     */
    public Transition {
        if (from == null || on == null || to == null) {
            throw new IllegalArgumentException("from, on and to cannot be null");
        }
        if (name == null) {
            name = "";
        }
        // guard는 null 허용
    }

    /**
     * 가드 없는 전이 생성.
     *
     * @param from 시작 상태 값
     * @param on 이벤트 값
     * @param to 목표 상태 값
     * @return Transition 인스턴스
     */
    public static Transition of(String from, String on, String to) {
        return new Transition(State.of(from), Event.of(on), State.of(to), "", null);
    }

    /**
     * 이름만 변경한 새 인스턴스 생성.
     *
     * @param name 이름
     * @return 새 Transition 인스턴스
     */
    public Transition named(String name) {
        return new Transition(from, on, to, name, guard);
    }

    /**
     * 가드만 변경한 새 인스턴스 생성.
     *
     * @param guard 가드 (null이면 가드 제거)
     * @return 새 Transition 인스턴스
     */
    public Transition guardedBy(Guard guard) {
        return new Transition(from, on, to, name, guard);
    }

    /**
     * 가드 조회.
     *
     * @return 가드 (없으면 empty)
     */
    public Optional<Guard> guardOptional() {
        return Optional.ofNullable(guard);
    }

    /**
     * 모든 식별자의 공백을 제거한 사본.
     *
     * @return 정규화된 Transition
     */
    public Transition normalize() {
        return new Transition(from.normalize(), on.normalize(), to.normalize(), name.strip(), guard);
    }

    /**
     * from, on, to가 모두 유효한지 확인.
     *
     * @return 모두 유효하면 true
     */
    public boolean isValid() {
        return from.isValid() && on.isValid() && to.isValid();
    }

    @Override
    public String toString() {
        return from + " --" + on + "--> " + to + (name.isEmpty() ? "" : " (" + name + ")");
    }
}
