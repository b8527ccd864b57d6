// IExtractionStrategy.java
package com.webharvest.core.api;

import com.webharvest.core.model.ContentItem;

import java.util.Optional;

/**
 * 본문 추출 전략 계약: 원본 HTML → 선택적 ContentItem.
 * 구현은 순수 함수여야 하며 절대 예외를 던지지 않는다(실패 = empty).
 */
public interface IExtractionStrategy {

    /** 로그용 짧은 이름 */
    String name();

    Optional<ContentItem> extract(String url, byte[] html);
}
