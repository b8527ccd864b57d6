package com.webharvest.core.discovery;

import com.webharvest.core.model.FetchResult;
import com.webharvest.core.util.UrlUtils;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.net.URI;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/** 3단계: 흔한 섹션 경로(/blog, /news ...) 페이지의 앵커 중 콘텐츠 URL. */
public final class SectionPathDiscovery implements DiscoveryStage {

    static final List<String> SECTION_PATHS = List.of(
            "/blog", "/blogs", "/articles", "/posts", "/news", "/resource", "/resources",
            "/insights", "/updates", "/content", "/press", "/media", "/stories");

    @Override public String name() { return "section-paths"; }

    @Override
    public Set<String> discover(DiscoveryContext ctx) {
        Set<String> out = new LinkedHashSet<>();
        for (String path : SECTION_PATHS) {
            URI sectionUri = UrlUtils.siteRoot(ctx.base(), path);
            Optional<FetchResult> resp = ctx.getOk(sectionUri);
            if (resp.isEmpty()) continue;

            URI pageUri = resp.get().getFinalUri();
            Document doc = Jsoup.parse(resp.get().text(), pageUri.toString());
            for (Element a : doc.select("a[href]")) {
                UrlUtils.resolve(pageUri, a.attr("href"))
                        .filter(ctx.heuristic()::isContentUrl)
                        .ifPresent(out::add);
            }
        }
        return out;
    }
}
