package com.webharvest.core.discovery;

import java.util.Set;

/**
 * URL 탐색 단계. 각 단계는 자기 결과 집합만 돌려주고 병합은 UrlDiscoverer 가 한다.
 */
public interface DiscoveryStage {

    String name();

    /** true 면 누적 결과가 임계값 미만일 때만 실행 */
    default boolean isFallback() { return false; }

    Set<String> discover(DiscoveryContext ctx) throws DiscoveryException;
}
