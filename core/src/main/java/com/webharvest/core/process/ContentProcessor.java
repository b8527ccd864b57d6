package com.webharvest.core.process;

import com.webharvest.core.model.ContentItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * 추출 결과 후처리: 템플릿 본문 제거 → 해시 중복 제거 → 청크 분할.
 * 입력 리스트는 변경하지 않는다.
 */
public final class ContentProcessor {

    private static final Logger LOG = LoggerFactory.getLogger(ContentProcessor.class);

    public static final String TEMPLATE_PREFIX = "[Template Content] ";

    static final List<String> BLOG_INDICATORS = List.of(
            "/blog/", "/blogs/", "/article/", "/articles/", "/post/", "/posts/",
            "/news/", "/resource/", "/resources/", "/insights/", "/updates/",
            "/content/", "/press/", "/media/", "/stories/");

    private final int templateThreshold;
    private final Chunker chunker;

    public ContentProcessor(int templateThreshold, int chunkSize) {
        if (templateThreshold < 1) throw new IllegalArgumentException("templateThreshold must be >= 1");
        this.templateThreshold = templateThreshold;
        this.chunker = new Chunker(chunkSize);
    }

    public List<ContentItem> process(List<ContentItem> items) {
        List<ContentItem> unique = dedupe(items);
        List<ContentItem> out = new ArrayList<>(unique.size());
        for (ContentItem it : unique) out.addAll(chunker.split(it));
        LOG.info("Processed {} items -> {} unique -> {} output", items.size(), unique.size(), out.size());
        return out;
    }

    public List<ContentItem> dedupe(List<ContentItem> items) {
        if (items.isEmpty()) return List.of();

        // ---- 1) 해시 빈도 ----
        List<String> hashes = new ArrayList<>(items.size());
        Map<String, Integer> counts = new HashMap<>();
        for (ContentItem it : items) {
            String h = ContentHasher.md5Hex(it.getContent());
            hashes.add(h);
            counts.merge(h, 1, Integer::sum);
        }
        Set<String> templates = new HashSet<>();
        counts.forEach((h, n) -> { if (n > templateThreshold) templates.add(h); });

        // ---- 2) 템플릿 + 블로그형 URL 제거 ----
        List<ContentItem> kept = new ArrayList<>();
        List<String> keptHashes = new ArrayList<>();
        for (int i = 0; i < items.size(); i++) {
            ContentItem it = items.get(i);
            if (templates.contains(hashes.get(i)) && isBlogLike(it.getSourceUrl())) continue;
            kept.add(it);
            keptHashes.add(hashes.get(i));
        }
        if (!templates.isEmpty()) {
            LOG.info("Template content detected ({} hashes), {} items dropped",
                    templates.size(), items.size() - kept.size());
        }
        if (kept.isEmpty()) {
            ContentItem first = items.get(0);
            return List.of(first.withTitle(TEMPLATE_PREFIX + first.getTitle()));
        }

        // ---- 3) 첫 등장만 유지 ----
        Set<String> seen = new HashSet<>();
        List<ContentItem> out = new ArrayList<>();
        for (int i = 0; i < kept.size(); i++) {
            if (seen.add(keptHashes.get(i))) out.add(kept.get(i));
        }
        return out;
    }

    static boolean isBlogLike(String url) {
        String u = url.toLowerCase(Locale.ROOT);
        for (String ind : BLOG_INDICATORS) {
            if (u.contains(ind)) return true;
        }
        return false;
    }
}
