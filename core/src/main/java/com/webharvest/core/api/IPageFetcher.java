// IPageFetcher.java
package com.webharvest.core.api;

import com.webharvest.core.http.FetchException;
import com.webharvest.core.model.FetchResult;

import java.net.URI;
import java.time.Duration;

/**
 * 페이지 수집 최소 계약: URI 를 받아 상태/본문을 돌려준다.
 * 비 200 응답은 예외가 아니라 결과로 반환, 네트워크 실패만 FetchException.
 */
public interface IPageFetcher {
    FetchResult fetch(URI uri, Duration timeout) throws FetchException;
}
