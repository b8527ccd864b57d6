package com.webharvest.core.discovery;

import com.webharvest.core.model.FetchResult;
import com.webharvest.core.util.UrlUtils;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * 5단계(폴백): 네비게이션 크롤.
 * 메인 페이지에서 "blog/articles/news..." 성격의 섹션 링크를 찾아 앞의 3개 섹션만 방문한다.
 */
public final class NavigationDiscovery implements DiscoveryStage {

    private static final Logger LOG = LoggerFactory.getLogger(NavigationDiscovery.class);

    static final List<String> NAV_KEYWORDS = List.of(
            "blog", "blogs", "articles", "posts", "news", "resources", "resource",
            "insights", "stories", "updates", "content", "press", "media",
            "guides", "whitepapers", "case studies", "learn", "knowledge");

    static final int MAX_SECTIONS = 3;
    static final int MAX_LOOSE_PER_SECTION = 10;

    @Override public String name() { return "navigation"; }
    @Override public boolean isFallback() { return true; }

    @Override
    public Set<String> discover(DiscoveryContext ctx) {
        Set<String> out = new LinkedHashSet<>();
        Optional<FetchResult> home = ctx.getOk(ctx.base());
        if (home.isEmpty()) return out;

        List<String> sections = findSections(ctx, home.get());
        int visited = 0;
        for (String section : sections) {
            if (visited >= MAX_SECTIONS) break;
            visited++;
            out.addAll(collectFromSection(ctx, section));
        }
        return out;
    }

    /** nav/header/menu 앵커 먼저, 그다음 전체 앵커. 텍스트 또는 href 키워드 매칭. */
    List<String> findSections(DiscoveryContext ctx, FetchResult home) {
        URI pageUri = home.getFinalUri();
        Document doc = Jsoup.parse(home.text(), pageUri.toString());

        List<Element> anchors = new ArrayList<>(doc.select("nav a[href], header a[href], menu a[href]"));
        anchors.addAll(doc.select("a[href]"));

        Set<String> sections = new LinkedHashSet<>();
        for (Element a : anchors) {
            String href = a.attr("href");
            String text = a.text().trim().toLowerCase(Locale.ROOT);
            String hrefLower = href.toLowerCase(Locale.ROOT);
            if (!containsKeyword(text) && !containsKeyword(hrefLower)) continue;

            UrlUtils.resolve(pageUri, href)
                    .filter(ctx.heuristic()::isSameHost)
                    .ifPresent(sections::add);
        }
        return new ArrayList<>(sections);
    }

    private Set<String> collectFromSection(DiscoveryContext ctx, String sectionUrl) {
        Set<String> strict = new LinkedHashSet<>();
        Optional<FetchResult> resp;
        try {
            resp = ctx.getOk(URI.create(sectionUrl));
        } catch (IllegalArgumentException e) {
            return strict;
        }
        if (resp.isEmpty()) return strict;

        URI pageUri = resp.get().getFinalUri();
        Document doc = Jsoup.parse(resp.get().text(), pageUri.toString());
        List<Element> links = doc.select("a[href]");

        for (Element a : links) {
            UrlUtils.resolve(pageUri, a.attr("href"))
                    .filter(u -> ctx.heuristic().isSectionContentUrl(u, sectionUrl))
                    .ifPresent(strict::add);
        }
        if (!strict.isEmpty()) {
            LOG.debug("Section {}: {} strict matches", sectionUrl, strict.size());
            return strict;
        }

        // 엄격 매칭 0건 → 느슨한 매칭(같은 호스트, 섹션 자신 제외), 섹션당 10개
        Set<String> loose = new LinkedHashSet<>();
        for (Element a : links) {
            if (loose.size() >= MAX_LOOSE_PER_SECTION) break;
            String href = a.attr("href").trim();
            if (href.isEmpty() || href.startsWith("#") || href.toLowerCase(Locale.ROOT).startsWith("javascript:")) continue;
            UrlUtils.resolve(pageUri, href)
                    .filter(ctx.heuristic()::isSameHost)
                    .filter(u -> !u.equals(sectionUrl))
                    .ifPresent(loose::add);
        }
        LOG.debug("Section {}: {} loose matches", sectionUrl, loose.size());
        return loose;
    }

    private static boolean containsKeyword(String s) {
        for (String k : NAV_KEYWORDS) if (s.contains(k)) return true;
        return false;
    }
}
