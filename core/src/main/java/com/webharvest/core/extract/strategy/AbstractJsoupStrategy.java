package com.webharvest.core.extract.strategy;

import com.webharvest.core.api.IExtractionStrategy;
import com.webharvest.core.extract.ContentClassifier;
import com.webharvest.core.extract.TitleResolver;
import com.webharvest.core.model.ContentItem;
import com.webharvest.core.model.ContentType;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.Optional;

/**
 * jsoup 기반 전략 공통 골격.
 * 파싱 → 원본에서 메타 제목 확보 → 본문 추출(하위 클래스) → 최소 길이 확인 → 제목/분류.
 * 어떤 실패도 empty 로 바꾼다.
 */
public abstract class AbstractJsoupStrategy implements IExtractionStrategy {

    private static final Logger LOG = LoggerFactory.getLogger(AbstractJsoupStrategy.class);

    /** 본문 추출. doc 은 자유롭게 변형해도 된다. 추출 불가면 빈 문자열 */
    protected abstract String extractText(Document doc);

    @Override
    public final Optional<ContentItem> extract(String url, byte[] html) {
        if (url == null || html == null || html.length == 0) return Optional.empty();
        try {
            Document doc = Jsoup.parse(new ByteArrayInputStream(html), null, url);
            Optional<String> metaTitle = TitleResolver.metadataTitle(doc);
            String docTitle = doc.title();

            if (Thread.currentThread().isInterrupted()) return Optional.empty();
            String text = normalize(extractText(doc));
            if (text.trim().length() < ContentItem.MIN_CONTENT_CHARS) return Optional.empty();
            if (Thread.currentThread().isInterrupted()) return Optional.empty();

            String title = TitleResolver.resolve(metaTitle, text, docTitle);
            ContentType type = ContentClassifier.classify(url, title, text);
            return Optional.of(new ContentItem(title, text, type, url));
        } catch (IOException | RuntimeException e) {
            LOG.debug("Strategy {} failed for {}: {}", name(), url, e.toString());
            return Optional.empty();
        }
    }

    /** 공백 줄 3개 이상 → 2개, 줄 끝 공백 제거 */
    static String normalize(String text) {
        if (text == null) return "";
        return text.replaceAll("[ \\t\\x0B\\f\\r]+\\n", "\n")
                .replaceAll("\\n{3,}", "\n\n")
                .trim();
    }
}
