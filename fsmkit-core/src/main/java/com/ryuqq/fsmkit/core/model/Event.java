package com.ryuqq.fsmkit.core.model;

/**
 * 상태 전이를 유발하는 이벤트 식별자.
 *
 * <p>검증 규칙은 {@link State}와 동일합니다 (공백 제거 후 1~64자,
 * 영숫자와 {@code _ - . :}만 허용).</p>
 *
 * <p><strong>예시:</strong></p>
 * <ul>
 *   <li>Event.of("SUBMIT")</li>
 *   <li>Event.of("payment:captured")</li>
 *   <li>Event.of("BAD@EVENT").isValid() → false</li>
 * </ul>
 *
 * @author FsmKit Team
 * @since 1.0.0
 */
public final class Event implements Comparable<Event> {

    private final String value;

    private Event(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Event value cannot be null");
        }
        this.value = value;
    }

    /**
     * Event 생성.
     *
     * @param value 이벤트 값 (검증하지 않음)
     * @return Event 인스턴스
     * @throws IllegalArgumentException value가 null인 경우
     */
    public static Event of(String value) {
        return new Event(value);
    }

    /**
     * 앞뒤 공백을 제거한 Event 반환.
     *
     * @return 정규화된 Event
     */
    public Event normalize() {
        String normalized = Identifiers.normalize(value);
        return normalized.equals(value) ? this : new Event(normalized);
    }

    /**
     * 정규화 후 값이 유효한 식별자인지 확인.
     *
     * @return 유효하면 true
     */
    public boolean isValid() {
        return Identifiers.isValid(value);
    }

    /**
     * Event 값 조회.
     *
     * @return Event 값
     */
    public String getValue() {
        return value;
    }

    @Override
    public int compareTo(Event other) {
        return value.compareTo(other.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Event event = (Event) o;
        return value.equals(event.value);
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
