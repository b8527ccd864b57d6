package com.webharvest.core.discovery;

import com.webharvest.core.model.FetchResult;
import com.webharvest.core.util.UrlUtils;

import java.net.URI;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 4단계(폴백): SPA 마크업 휴리스틱.
 * 렌더 없이 원문 HTML/인라인 JSON 에서 href 패턴을 정규식으로 긁는다.
 */
public final class SpaLinkDiscovery implements DiscoveryStage {

    private static final List<Pattern> HREF_PATTERNS = List.of(
            Pattern.compile("href=\"([^\"]*(?:blog|article|post)[^\"]*)\"", Pattern.CASE_INSENSITIVE),
            Pattern.compile("href=\"(/[^\"]*)\"", Pattern.CASE_INSENSITIVE));

    private static final Pattern JSON_HREF = Pattern.compile("\"href\":\\s*\"([^\"]*)\"");

    @Override public String name() { return "spa"; }
    @Override public boolean isFallback() { return true; }

    @Override
    public Set<String> discover(DiscoveryContext ctx) {
        Set<String> out = new LinkedHashSet<>();
        Optional<FetchResult> resp = ctx.getOk(ctx.base());
        if (resp.isEmpty()) return out;

        URI base = ctx.base();
        String html = resp.get().text();

        // ---- 1) 마크업 href ----
        for (Pattern p : HREF_PATTERNS) {
            Matcher m = p.matcher(html);
            while (m.find()) {
                UrlUtils.resolve(base, m.group(1))
                        .filter(ctx.heuristic()::isContentUrl)
                        .ifPresent(out::add);
            }
        }

        // ---- 2) 인라인 JSON "href": "/..." ----
        Matcher jm = JSON_HREF.matcher(html);
        while (jm.find()) {
            String href = jm.group(1);
            if (!href.startsWith("/") || href.startsWith("//")) continue;
            String lower = href.toLowerCase(Locale.ROOT);
            if (lower.contains("blog") || lower.contains("article") || lower.contains("post")) {
                UrlUtils.resolve(base, href)
                        .filter(ctx.heuristic()::isSameHost)
                        .ifPresent(out::add);
            }
        }
        return out;
    }
}
