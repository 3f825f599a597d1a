package com.ryuqq.bridge.adapter.runner;

import com.ryuqq.bridge.core.model.Fingerprint;
import com.ryuqq.bridge.core.model.Request;

/**
 * 캐시 키 범위.
 *
 * <ul>
 *   <li>GLOBAL: 본문 Fingerprint만 사용 (요청자가 달라도 같은 본문이면 캐시 공유)</li>
 *   <li>PER_REQUESTER: 요청자 ID로 네임스페이스를 분리 (요청자 간 캐시 격리)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum CacheScope {

    GLOBAL {
        @Override
        public Fingerprint keyFor(Request request) {
            return request.fingerprint();
        }
    },

    PER_REQUESTER {
        @Override
        public Fingerprint keyFor(Request request) {
            return request.fingerprint().withNamespace(request.requesterId());
        }
    };

    /**
     * 요청의 캐시 키 계산.
     *
     * @param request 요청
     * @return 캐시 키
     */
    public abstract Fingerprint keyFor(Request request);
}
