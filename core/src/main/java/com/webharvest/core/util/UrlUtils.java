package com.webharvest.core.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Optional;

/**
 * URL 해석/비교 유틸.
 * 후보 URL 집합은 "fragment 제거 후 문자열 정확 일치"로 중복 판정한다.
 */
public final class UrlUtils {
    private UrlUtils() {}

    /** base 기준 href 해석 → 절대 URL(fragment 제거). http(s) 아니면 empty */
    public static Optional<String> resolve(URI base, String href) {
        if (base == null || href == null) return Optional.empty();
        String h = href.trim();
        if (h.isEmpty() || h.startsWith("#")) return Optional.empty();
        String lower = h.toLowerCase(Locale.ROOT);
        if (lower.startsWith("javascript:") || lower.startsWith("mailto:") || lower.startsWith("tel:")) {
            return Optional.empty();
        }
        try {
            URI b = (base.getRawPath() == null || base.getRawPath().isEmpty())
                    ? base.resolve("/") : base;     // "https://a.com" + "x" → "https://a.comx" 방지
            URI abs = b.resolve(new URI(escapeSpaces(h)));
            return Optional.ofNullable(toAbsoluteHttp(abs));
        } catch (IllegalArgumentException | URISyntaxException e) {
            return Optional.empty();
        }
    }

    /** 문자열 URL 의 fragment 만 제거(그 외 정규화 없음). 파싱 불가/비 http(s)면 null */
    public static String stripFragment(String url) {
        if (url == null) return null;
        try {
            return toAbsoluteHttp(new URI(escapeSpaces(url.trim())));
        } catch (URISyntaxException e) {
            return null;
        }
    }

    private static String toAbsoluteHttp(URI u) {
        String scheme = u.getScheme();
        if (scheme == null) return null;
        if (!scheme.equalsIgnoreCase("http") && !scheme.equalsIgnoreCase("https")) return null;
        if (u.getRawAuthority() == null) return null;
        String s = u.toString();
        int hash = s.indexOf('#');
        return hash >= 0 ? s.substring(0, hash) : s;
    }

    /** host 소문자 비교 */
    public static boolean sameHost(URI a, URI b) {
        if (a == null || b == null) return false;
        return host(a).equals(host(b));
    }

    public static boolean sameHost(URI base, String url) {
        try {
            return sameHost(base, new URI(escapeSpaces(url)));
        } catch (URISyntaxException e) {
            return false;
        }
    }

    public static String host(URI u) {
        String h = (u.getHost() != null ? u.getHost() : u.getAuthority());
        return h == null ? "" : h.toLowerCase(Locale.ROOT);
    }

    /** 소문자 경로(없으면 "") */
    public static String lowerPath(String url) {
        try {
            String p = new URI(escapeSpaces(url)).getPath();
            return p == null ? "" : p.toLowerCase(Locale.ROOT);
        } catch (URISyntaxException e) {
            return "";
        }
    }

    /** base 의 scheme+authority 에 절대 경로를 붙인다: ("https://a.com/x", "/feed") → https://a.com/feed */
    public static URI siteRoot(URI base, String absPath) {
        return URI.create(base.getScheme() + "://" + base.getRawAuthority() + absPath);
    }

    private static String escapeSpaces(String s) {
        return s.indexOf(' ') >= 0 ? s.replace(" ", "%20") : s;
    }
}
