package com.ryuqq.bridge.core.model;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * 요청 본문의 결정적(deterministic) 다이제스트.
 *
 * <p>Fingerprint는 캐시 키로 사용되며, 같은 본문은 JVM이나 프로세스가 달라도
 * 항상 같은 값을 가집니다. {@link String#hashCode()}와 달리 SHA-256을 사용하므로
 * 우연한 충돌 가능성이 사실상 없습니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 *
 * <p><strong>네임스페이스:</strong></p>
 * <pre>
 * Fingerprint global = Fingerprint.of("I need a refund");
 * Fingerprint scoped = global.withNamespace("user-001");  // 요청자별 캐시 격리
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class Fingerprint {

    private static final String ALGORITHM = "SHA-256";

    private final String value;

    private Fingerprint(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Fingerprint cannot be null or blank");
        }
        this.value = value;
    }

    /**
     * 본문으로부터 Fingerprint 생성.
     *
     * @param content 요청 본문 (빈 문자열 허용)
     * @return Fingerprint 인스턴스
     * @throws IllegalArgumentException content가 null인 경우
     */
    public static Fingerprint of(String content) {
        if (content == null) {
            throw new IllegalArgumentException("content cannot be null");
        }
        return new Fingerprint(digest(content));
    }

    /**
     * 이미 계산된 다이제스트 값으로 Fingerprint 복원.
     *
     * @param value 16진수 다이제스트 값
     * @return Fingerprint 인스턴스
     * @throws IllegalArgumentException value가 null이거나 빈 문자열인 경우
     */
    public static Fingerprint fromValue(String value) {
        return new Fingerprint(value);
    }

    /**
     * 네임스페이스가 적용된 새 Fingerprint 생성.
     *
     * <p>같은 본문이라도 네임스페이스가 다르면 다른 Fingerprint가 됩니다.</p>
     *
     * @param namespace 네임스페이스 (예: 요청자 ID)
     * @return 네임스페이스가 적용된 Fingerprint
     * @throws IllegalArgumentException namespace가 null인 경우
     */
    public Fingerprint withNamespace(String namespace) {
        if (namespace == null) {
            throw new IllegalArgumentException("namespace cannot be null");
        }
        return new Fingerprint(digest(namespace + '\u0000' + value));
    }

    /**
     * Fingerprint 값 조회.
     *
     * @return 64자 16진수 문자열
     */
    public String getValue() {
        return value;
    }

    private static String digest(String input) {
        try {
            MessageDigest md = MessageDigest.getInstance(ALGORITHM);
            return HexFormat.of().formatHex(md.digest(input.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            // 모든 JVM은 SHA-256을 제공해야 함
            throw new IllegalStateException(ALGORITHM + " not available", e);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Fingerprint that = (Fingerprint) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "Fingerprint{" + value.substring(0, Math.min(12, value.length())) + '}';
    }
}
