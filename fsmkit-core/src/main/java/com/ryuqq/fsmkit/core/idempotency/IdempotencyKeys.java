package com.ryuqq.fsmkit.core.idempotency;

import com.ryuqq.fsmkit.core.exception.ErrorKind;
import com.ryuqq.fsmkit.core.exception.FsmException;
import com.ryuqq.fsmkit.core.log.TransitionLog;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Map;
import java.util.function.Function;

/**
 * 기본 {@link IdempotencyKeyFunction} 구현 모음.
 *
 * <p><strong>제공 전략:</strong></p>
 * <ul>
 *   <li>{@link #byMetaField(String)}: {@code machineName:machineId:<meta[field]>} (외부 이벤트 ID)</li>
 *   <li>{@link #byInput(Function)}: {@code machineName:machineId:<extractor(input)>}</li>
 *   <li>{@link #fingerprint()}: machineName, machineId, from, on, 정렬된 meta의 SHA-256</li>
 * </ul>
 *
 * <p>세 전략 모두 at을 키에 포함하지 않으므로, 나중 시각으로 재시도해도 같은 키가 생성됩니다.</p>
 *
 * @author FsmKit Team
 * @since 1.0.0
 */
public final class IdempotencyKeys {

    private static final String SEPARATOR = ":";

    // Utility class - prevent instantiation
    private IdempotencyKeys() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * machineId와 고정 접미사로 구성되는 키 함수.
     *
     * <p>하나의 머신 인스턴스에서 특정 외부 이벤트를 한 번만 적용할 때 사용합니다.
     * 예: {@code byMachineId("event:123")} → {@code tx-1:event:123}</p>
     *
     * @param suffix 외부 이벤트 식별 접미사
     * @return 키 함수
     * @throws IllegalArgumentException suffix가 null이거나 빈 문자열인 경우
     */
    public static IdempotencyKeyFunction byMachineId(String suffix) {
        if (suffix == null || suffix.isBlank()) {
            throw new IllegalArgumentException("suffix cannot be null or blank");
        }
        return (machineName, machineId, from, on, at, meta, input) -> machineId + SEPARATOR + suffix;
    }

    /**
     * meta의 특정 필드(예: eventId)를 외부 이벤트 ID로 사용하는 키 함수.
     *
     * @param field meta key
     * @return 키 함수 (필드가 없거나 비어 있으면 MISSING_IDEMPOTENCY_KEY)
     * @throws IllegalArgumentException field가 null이거나 빈 문자열인 경우
     */
    public static IdempotencyKeyFunction byMetaField(String field) {
        if (field == null || field.isBlank()) {
            throw new IllegalArgumentException("field cannot be null or blank");
        }
        return (machineName, machineId, from, on, at, meta, input) -> {
            String eventId = meta == null ? null : meta.get(field);
            if (eventId == null || eventId.isBlank()) {
                throw new FsmException(ErrorKind.MISSING_IDEMPOTENCY_KEY,
                    "missing idempotency key: meta field '" + field + "' is absent");
            }
            return machineName + SEPARATOR + machineId + SEPARATOR + eventId.strip();
        };
    }

    /**
     * 도메인 입력에서 외부 이벤트 ID를 추출하는 키 함수.
     *
     * @param extractor input → 이벤트 ID (null 반환 시 MISSING_IDEMPOTENCY_KEY)
     * @return 키 함수
     * @throws IllegalArgumentException extractor가 null인 경우
     */
    public static IdempotencyKeyFunction byInput(Function<Object, String> extractor) {
        if (extractor == null) {
            throw new IllegalArgumentException("extractor cannot be null");
        }
        return (machineName, machineId, from, on, at, meta, input) -> {
            String eventId = extractor.apply(input);
            if (eventId == null || eventId.isBlank()) {
                throw new FsmException(ErrorKind.MISSING_IDEMPOTENCY_KEY,
                    "missing idempotency key: input yielded no event id");
            }
            return machineName + SEPARATOR + machineId + SEPARATOR + eventId.strip();
        };
    }

    /**
     * 요청 내용 fingerprint 키 함수.
     *
     * <p>입력: machineName, machineId, from, on, 그리고 key 정렬된 meta의 각 key/value
     * (from, on은 정규화). 각 필드는 {@code <길이>:<값>} 형태로 이어 붙이므로
     * 값에 구분 문자가 포함되어도 서로 다른 입력이 같은 fingerprint를 만들지 않습니다.
     * at과 input은 포함하지 않습니다.</p>
     *
     * @return 키 함수 ({@code machineName:machineId:<sha256 hex>})
     */
    public static IdempotencyKeyFunction fingerprint() {
        return (machineName, machineId, from, on, at, meta, input) -> {
            StringBuilder material = new StringBuilder(128);
            appendField(material, machineName);
            appendField(material, machineId);
            appendField(material, from.normalize().getValue());
            appendField(material, on.normalize().getValue());
            Map<String, String> sorted = TransitionLog.copyMeta(meta);
            material.append(sorted.size()).append('#');
            for (Map.Entry<String, String> entry : sorted.entrySet()) {
                appendField(material, entry.getKey());
                appendField(material, entry.getValue());
            }
            return machineName + SEPARATOR + machineId + SEPARATOR + sha256Hex(material.toString());
        };
    }

    // length-prefixed: <length>:<value>
    private static void appendField(StringBuilder material, String value) {
        material.append(value.length()).append(':').append(value);
    }

    private static String sha256Hex(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            // SHA-256은 모든 JRE에서 필수 지원
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
