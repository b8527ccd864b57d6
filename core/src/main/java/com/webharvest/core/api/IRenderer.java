// IRenderer.java
package com.webharvest.core.api;

import com.webharvest.core.model.RenderResult;
import com.webharvest.core.render.RenderException;

import java.time.Duration;
import java.util.Set;

/** 헤드리스 브라우저 최소 계약. 스크랩당 1회 생성, 종료 시 close. */
public interface IRenderer extends AutoCloseable {

    RenderResult render(String url, Duration timeout) throws RenderException;

    /** 렌더 + 클릭/데이터 속성/API 응답 가로채기로 같은 호스트 링크 수집 */
    Set<String> discoverLinks(String baseUrl) throws RenderException;

    @Override default void close() {}
}
