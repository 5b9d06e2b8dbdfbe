package com.ryuqq.fsmkit.core.model;

/**
 * State/Event 공통 식별자 규칙.
 *
 * <p><strong>유효성 규칙:</strong></p>
 * <ul>
 *   <li>앞뒤 공백 제거 후 1~64자</li>
 *   <li>허용 문자: A-Z, a-z, 0-9, 언더스코어(_), 하이픈(-), 점(.), 콜론(:)</li>
 *   <li>대소문자 변환 없음</li>
 * </ul>
 *
 * @author FsmKit Team
 * @since 1.0.0
 */
final class Identifiers {

    static final int MAX_LENGTH = 64;

    private Identifiers() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 앞뒤 공백 제거.
     *
     * <p>공백 기준: ASCII 제어 공백(U+0009~U+000D), U+0085,
     * 그리고 Unicode 공백 문자(Zs, Zl, Zp: U+0020, U+00A0, U+1680, U+2000~U+200A,
     * U+2028, U+2029, U+202F, U+205F, U+3000). Unicode White_Space 속성과 동일합니다.</p>
     */
    static String normalize(String value) {
        int start = 0;
        int end = value.length();
        while (start < end && isSpace(value.charAt(start))) {
            start++;
        }
        while (end > start && isSpace(value.charAt(end - 1))) {
            end--;
        }
        return value.substring(start, end);
    }

    static boolean isSpace(char c) {
        return (c >= '\t' && c <= '\r') || c == '\u0085' || Character.isSpaceChar(c);
    }

    static boolean isValid(String value) {
        String v = normalize(value);
        if (v.isEmpty() || v.length() > MAX_LENGTH) {
            return false;
        }
        for (int i = 0; i < v.length(); i++) {
            if (!isAllowed(v.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    // ASCII only
    private static boolean isAllowed(char c) {
        return (c >= 'A' && c <= 'Z')
            || (c >= 'a' && c <= 'z')
            || (c >= '0' && c <= '9')
            || c == '_' || c == '-' || c == '.' || c == ':';
    }
}
