package com.webharvest.core.discovery;

import com.webharvest.core.util.UrlUtils;

import java.net.URI;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * "글(콘텐츠) URL 처럼 보이는가" 판정.
 * - 사이트 전역 판정(isContentUrl): 사이트맵/섹션 경로/SPA 단계
 * - 섹션 상대 판정(isSectionContentUrl): 네비게이션 단계(섹션 페이지 안에서 더 관대)
 */
public final class ContentUrlHeuristic {

    private static final List<String> SKIP_MARKERS = List.of(
            "/tag/", "/category/", "/author/", "/page/",
            "/search", "/login", "/register", "/contact", "/about",
            "/privacy", "/terms", "/legal/", "/schedule", "/demo",
            "/signup", "/download", "/pricing", "/support",
            ".pdf", ".jpg", ".png", ".gif", ".css", ".js",
            ".xml", ".txt", ".ico", ".woff", ".woff2", ".ttf", ".eot",
            "/_next/", "/static/", "/assets/");

    private static final List<String> SECTION_SKIP_MARKERS = List.of(
            "/tag/", "/category/", "/author/", "/page/",
            "/search", "/login", "/register", "/contact", "/about",
            "/privacy", "/terms", "/legal/", "/schedule", "/demo",
            "/signup", "/download", "/pricing", "/support",
            ".pdf", ".jpg", ".png", ".gif", ".css", ".js",
            ".xml", ".txt", ".ico", "/api/", "/_next/");

    private static final Pattern CONTENT_SEGMENT = Pattern.compile(
            "/(blog|blogs|post|posts|article|articles|news|casestudies|case-studies|story|stories"
                    + "|resources|resource|insights|whitepapers|guides|updates|content|press|media)/"
                    + "|/\\d{4}/");

    private static final Pattern SECTION_POST_PATTERN = Pattern.compile(
            "/\\d{4}/"
                    + "|/(post|posts|article|articles|story|stories|entry|entries"
                    + "|resource|resources|insights|updates|content|press|media|news)/"
                    + "|/(how|what|why|guide|tutorial)-");

    private static final List<String> CORPORATE_SEGMENTS = List.of(
            "solutions/", "products/", "services/", "industries/",
            "company/", "careers/", "investors/", "partners/");

    private final URI base;

    public ContentUrlHeuristic(URI base) {
        this.base = Objects.requireNonNull(base, "base");
    }

    public URI base() { return base; }

    public boolean isSameHost(String url) {
        return url != null && UrlUtils.sameHost(base, url);
    }

    public boolean isContentUrl(String url) {
        if (!isSameHost(url)) return false;
        String path = UrlUtils.lowerPath(url);

        for (String m : SKIP_MARKERS) {
            if (path.contains(m)) return false;
        }
        if (CONTENT_SEGMENT.matcher(path).find()) return true;

        // 구조가 충분히 깊고 회사 소개성 경로가 아니면 허용
        if (path.length() > 1 && countSlashes(path) >= 2) {
            for (String c : CORPORATE_SEGMENTS) {
                if (path.contains(c)) return false;
            }
            return true;
        }
        return false;
    }

    public boolean isSectionContentUrl(String url, String sectionUrl) {
        if (!isSameHost(url)) return false;
        String path = UrlUtils.lowerPath(url);

        for (String m : SECTION_SKIP_MARKERS) {
            if (path.contains(m)) return false;
        }

        String sectionPath = UrlUtils.lowerPath(sectionUrl);
        if (path.startsWith(sectionPath) && !path.equals(sectionPath)
                && segments(path) > segments(sectionPath)) {
            return true;
        }
        return SECTION_POST_PATTERN.matcher(path).find();
    }

    private static int countSlashes(String s) {
        int n = 0;
        for (int i = 0; i < s.length(); i++) if (s.charAt(i) == '/') n++;
        return n;
    }

    private static int segments(String path) {
        int n = 0;
        for (String p : path.split("/")) if (!p.isEmpty()) n++;
        return n;
    }
}
