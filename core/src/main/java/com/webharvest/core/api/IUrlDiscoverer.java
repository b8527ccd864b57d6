// IUrlDiscoverer.java
package com.webharvest.core.api;

import java.net.URI;
import java.util.Set;

/** URL 탐색 최소 계약: 사이트 기준 URL → 중복 없는 후보 URL 집합(삽입 순서 유지). */
public interface IUrlDiscoverer {
    Set<String> discover(URI baseUrl);
}
