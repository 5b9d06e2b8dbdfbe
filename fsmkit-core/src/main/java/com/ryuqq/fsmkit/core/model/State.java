package com.ryuqq.fsmkit.core.model;

/**
 * 상태 머신의 상태 식별자.
 *
 * <p>State는 불투명한 문자열 식별자이며, 생성 시점에는 검증하지 않습니다.
 * 호출자가 전달한 원본 값을 그대로 보관하고, 매칭 직전에 {@link #normalize()}와
 * {@link #isValid()}로 정규화/검증합니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <ul>
 *   <li>State.of("PENDING")</li>
 *   <li>State.of(" PENDING ").normalize() → PENDING</li>
 *   <li>State.of("BAD STATE").isValid() → false</li>
 * </ul>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 *
 * @author FsmKit Team
 * @since 1.0.0
 */
public final class State implements Comparable<State> {

    /**
     * 다음 상태가 없음을 나타내는 빈 상태.
     */
    public static final State EMPTY = new State("");

    private final String value;

    private State(String value) {
        if (value == null) {
            throw new IllegalArgumentException("State value cannot be null");
        }
        this.value = value;
    }

    /**
     * State 생성.
     *
     * @param value 상태 값 (검증하지 않음)
     * @return State 인스턴스
     * @throws IllegalArgumentException value가 null인 경우
     */
    public static State of(String value) {
        return new State(value);
    }

    /**
     * 앞뒤 공백을 제거한 State 반환.
     *
     * <p>멱등: {@code s.normalize().normalize().equals(s.normalize())}</p>
     *
     * @return 정규화된 State
     */
    public State normalize() {
        String normalized = Identifiers.normalize(value);
        return normalized.equals(value) ? this : new State(normalized);
    }

    /**
     * 정규화 후 값이 유효한 식별자인지 확인.
     *
     * @return 1~64자이고 허용 문자로만 구성된 경우 true
     */
    public boolean isValid() {
        return Identifiers.isValid(value);
    }

    /**
     * 빈 상태인지 확인.
     *
     * @return 값이 빈 문자열이면 true
     */
    public boolean isEmpty() {
        return value.isEmpty();
    }

    /**
     * State 값 조회.
     *
     * @return State 값
     */
    public String getValue() {
        return value;
    }

    @Override
    public int compareTo(State other) {
        return value.compareTo(other.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        State state = (State) o;
        return value.equals(state.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
