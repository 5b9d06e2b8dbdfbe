package com.ryuqq.fsmkit.core.log;

import com.ryuqq.fsmkit.core.model.Event;
import com.ryuqq.fsmkit.core.model.State;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.SignStyle;
import java.time.temporal.ChronoField;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * 한 번의 상태 전이 평가 결과 기록.
 *
 * <p>TransitionLog는 감사(audit) 기록이자 멱등성 저장 단위입니다.
 * 성공/실패와 관계없이 모든 평가는 정확히 하나의 TransitionLog를 생성합니다.</p>
 *
 * <p><strong>불변성:</strong></p>
 * <ul>
 *   <li>meta는 생성 시점에 복사되며 호출자의 Map을 참조하지 않음</li>
 *   <li>반환되는 meta는 수정 불가</li>
 * </ul>
 *
 * <p><strong>정규 문자열 형식:</strong></p>
 * <pre>
 * from=&lt;F&gt;|on=&lt;E&gt;|to=&lt;T&gt;|at=&lt;RFC3339 nano UTC&gt;|allowed=&lt;1|0&gt;|reason=&lt;code&gt;[|m=&lt;key&gt;=&lt;value&gt;]*
 * </pre>
 * <p>meta 항목은 key 오름차순으로 정렬되므로, 삽입 순서가 달라도 같은 문자열이 생성됩니다.</p>
 *
 * @param machineId 머신 인스턴스 식별자 (예: tx-1)
 * @param from 시작 상태 (정규화됨)
 * @param on 이벤트 (정규화됨)
 * @param to 목표 상태 (규칙이 없으면 빈 상태)
 * @param at 평가 시각 (UTC)
 * @param meta 메타데이터 (복사본, key 정렬)
 * @param allowed 전이 허용 여부
 * @param reason 사유 코드
 *
 * @author FsmKit Team
 * @since 1.0.0
 */
public record TransitionLog(
    String machineId,
    State from,
    Event on,
    State to,
    Instant at,
    Map<String, String> meta,
    boolean allowed,
    ReasonCode reason
) {

    private static final DateTimeFormatter RFC3339_NANO = new DateTimeFormatterBuilder()
        // 9999년 이후는 '+' 없이 자릿수만 늘어남 (예: 10000-01-01T00:00:00Z)
        .appendValue(ChronoField.YEAR, 4, 10, SignStyle.NORMAL)
        .appendPattern("-MM-dd'T'HH:mm:ss")
        .appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true)
        .appendLiteral('Z')
        .toFormatter()
        .withZone(ZoneOffset.UTC);

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 null이거나 meta에 null key/value가 있는 경우
     */
    public TransitionLog {
        if (machineId == null) {
            throw new IllegalArgumentException("machineId cannot be null");
        }
        if (from == null || on == null || to == null) {
            throw new IllegalArgumentException("from, on and to cannot be null");
        }
        if (at == null) {
            throw new IllegalArgumentException("at cannot be null");
        }
        if (reason == null) {
            throw new IllegalArgumentException("reason cannot be null");
        }
        meta = copyMeta(meta);
    }

    /**
     * 정규 문자열 생성.
     *
     * <p>공백 없음, 필드 순서 고정, 시각은 UTC RFC3339 (나노초, 후행 0 제거).
     * 동일한 필드 값은 항상 바이트 단위로 동일한 문자열을 생성합니다.</p>
     *
     * @return 정규 문자열
     */
    public String canonicalString() {
        StringBuilder b = new StringBuilder(128);
        b.append("from=").append(from.getValue())
            .append("|on=").append(on.getValue())
            .append("|to=").append(to.getValue())
            .append("|at=").append(formatTimestamp(at))
            .append("|allowed=").append(allowed ? '1' : '0')
            .append("|reason=").append(reason.code());
        for (String pair : canonicalMetaPairs()) {
            b.append("|m=").append(pair);
        }
        return b.toString();
    }

    /**
     * key 오름차순으로 정렬된 {@code key=value} 목록.
     *
     * @return 정렬된 meta 쌍 (meta가 비어 있으면 빈 목록)
     */
    public List<String> canonicalMetaPairs() {
        if (meta.isEmpty()) {
            return List.of();
        }
        List<String> pairs = new ArrayList<>(meta.size());
        // meta는 TreeMap 복사본이므로 이미 key 순서
        for (Map.Entry<String, String> entry : meta.entrySet()) {
            pairs.add(entry.getKey() + "=" + entry.getValue());
        }
        return Collections.unmodifiableList(pairs);
    }

    /**
     * 정규 문자열에 사용되는 시각 형식.
     *
     * <p>예: {@code 2026-02-15T00:00:00Z}, {@code 2026-02-15T00:00:00.123456789Z}</p>
     *
     * @param instant 시각
     * @return RFC3339 나노초 UTC 문자열
     */
    public static String formatTimestamp(Instant instant) {
        return RFC3339_NANO.format(instant);
    }

    /**
     * meta를 key 정렬된 수정 불가 복사본으로 변환.
     *
     * @param meta 원본 (null이면 빈 Map)
     * @return 복사본
     * @throws IllegalArgumentException null key 또는 null value가 있는 경우
     */
    public static Map<String, String> copyMeta(Map<String, String> meta) {
        if (meta == null || meta.isEmpty()) {
            return Collections.emptyMap();
        }
        TreeMap<String, String> copy = new TreeMap<>();
        for (Map.Entry<String, String> entry : meta.entrySet()) {
            if (entry.getKey() == null || entry.getValue() == null) {
                throw new IllegalArgumentException("meta cannot contain null keys or values");
            }
            copy.put(entry.getKey(), entry.getValue());
        }
        return Collections.unmodifiableMap(copy);
    }
}
