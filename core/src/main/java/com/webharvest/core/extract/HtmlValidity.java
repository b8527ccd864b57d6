package com.webharvest.core.extract;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 평문 HTTP 응답이 "그럴듯한 HTML 문서"인지 판정.
 * 실패 시 HTTP 경로는 결론 없음으로 보고 브라우저 렌더(켜져 있으면)로 넘어간다.
 */
public final class HtmlValidity {

    public static final int MIN_BODY_BYTES = 1000;

    private static final List<String> INDICATORS = List.of(
            "p", "div", "article", "main", "section", "h1", "h2", "h3");
    private static final Pattern CONTENT_TAG =
            Pattern.compile("<(p|div|article|main|section|h1|h2|h3)[\\s>/]");
    private static final Pattern SCRIPT_TAG = Pattern.compile("<script[\\s>]");

    private HtmlValidity() {}

    public static boolean isPlausible(byte[] body) {
        return check(body) == null;
    }

    /** 실패 사유(로그용). 통과면 null */
    public static String check(byte[] body) {
        if (body == null || body.length < MIN_BODY_BYTES) {
            return "body too small (" + (body == null ? 0 : body.length) + " bytes)";
        }
        String lower = new String(body, StandardCharsets.UTF_8).toLowerCase(Locale.ROOT);
        if (!lower.contains("<html") && !lower.contains("<body")) {
            return "no <html>/<body>";
        }

        // 서로 다른 콘텐츠 태그 종류 수 + 총 등장 횟수
        int kinds = 0;
        for (String tag : INDICATORS) {
            if (Pattern.compile("<" + tag + "[\\s>/]").matcher(lower).find()) kinds++;
        }
        int contentTags = count(CONTENT_TAG.matcher(lower));
        int scripts = count(SCRIPT_TAG.matcher(lower));

        if (kinds < 2) return "fewer than 2 content tag kinds";
        if (scripts > 0 && contentTags * 2 <= scripts) {
            return "script-dominated (content=" + contentTags + ", script=" + scripts + ")";
        }
        return null;
    }

    private static int count(Matcher m) {
        int n = 0;
        while (m.find()) n++;
        return n;
    }
}
