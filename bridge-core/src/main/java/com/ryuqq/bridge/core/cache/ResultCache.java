package com.ryuqq.bridge.core.cache;

import com.ryuqq.bridge.core.model.Fingerprint;
import com.ryuqq.bridge.core.model.Result;

import java.util.Optional;

/**
 * Result Cache SPI.
 *
 * <p>백엔드 결과를 Fingerprint 기준으로 일정 시간(TTL) 동안 보관하여
 * 동일한 요청에 대한 중복 작업을 제거합니다.</p>
 *
 * <p><strong>계약:</strong></p>
 * <ul>
 *   <li>TTL이 지난 항목은 물리적으로 남아 있어도 {@link #get(Fingerprint)}에서 없는 것으로 취급</li>
 *   <li>{@link #put(Fingerprint, Result)}는 항상 덮어쓰며 원자적으로 교체</li>
 *   <li>동시 get/put에서 일부만 쓰여진 Result가 관측되지 않음</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface ResultCache {

    /**
     * 캐시 조회.
     *
     * <p>만료된 항목은 이 시점에 제거될 수 있습니다.</p>
     *
     * @param fingerprint 캐시 키
     * @return 유효한 결과 (없거나 만료되었으면 empty)
     * @throws IllegalArgumentException fingerprint가 null인 경우
     */
    Optional<Result> get(Fingerprint fingerprint);

    /**
     * 캐시 저장 (항상 덮어씀).
     *
     * @param fingerprint 캐시 키
     * @param result 저장할 결과
     * @throws IllegalArgumentException fingerprint 또는 result가 null인 경우
     */
    void put(Fingerprint fingerprint, Result result);

    /**
     * 만료된 항목 일괄 제거 (주기적 스윕용).
     *
     * @return 제거된 항목 수
     */
    int evictExpired();

    /**
     * 물리적으로 보관 중인 항목 수 (만료되었지만 아직 제거되지 않은 항목 포함).
     *
     * @return 항목 수
     */
    int size();

    /**
     * 모든 항목 제거.
     */
    void clear();
}
