package com.webharvest.core.extract;

import com.webharvest.core.model.ContentType;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * (url, title, content) → ContentType. 순수 함수, 판정 순서 고정:
 * 플랫폼 도메인 → URL/제목 키워드 그룹 → 튜토리얼 본문 신호 → blog
 */
public final class ContentClassifier {

    private static final Map<ContentType, List<String>> KEYWORD_GROUPS = new LinkedHashMap<>();
    static {
        KEYWORD_GROUPS.put(ContentType.PODCAST_TRANSCRIPT, List.of("podcast", "episode", "transcript", "audio", "listen"));
        KEYWORD_GROUPS.put(ContentType.CALL_TRANSCRIPT, List.of("transcript", "interview", "conversation", "call", "recording"));
        KEYWORD_GROUPS.put(ContentType.BOOK, List.of("book", "chapter", "manual", "documentation", "reference"));
        KEYWORD_GROUPS.put(ContentType.NEWS, List.of("/news/", "breaking", "announcement", "press-release", "update"));
    }

    private static final List<String> TUTORIAL_PHRASES = List.of(
            "step 1", "step one", "first step", "tutorial:", "how to",
            "walkthrough", "guide:", "instructions", "follow these steps");

    private static final List<String> STEP_PREFIXES = List.of("1.", "2.", "3.", "4.", "5.");

    private ContentClassifier() {}

    public static ContentType classify(String url, String title, String content) {
        String u = lower(url);
        String t = lower(title);

        // ---- 1) 플랫폼 ----
        if (u.contains("substack.com") || u.contains("medium.com")) return ContentType.BLOG;
        if (u.contains("linkedin.com")) return ContentType.LINKEDIN_POST;
        if (u.contains("reddit.com")) return ContentType.REDDIT_COMMENT;

        // ---- 2) URL/제목 키워드 ----
        for (Map.Entry<ContentType, List<String>> e : KEYWORD_GROUPS.entrySet()) {
            for (String k : e.getValue()) {
                if (u.contains(k) || t.contains(k)) return e.getKey();
            }
        }

        // ---- 3) 튜토리얼 ----
        String c = lower(content);
        String[] words = c.trim().isEmpty() ? new String[0] : c.trim().split("\\s+");
        if (words.length > 100) {
            int phrases = 0;
            for (String p : TUTORIAL_PHRASES) if (c.contains(p)) phrases++;

            int numbered = 0;
            for (int i = 0; i < Math.min(200, words.length); i++) {
                for (String prefix : STEP_PREFIXES) {
                    if (words[i].startsWith(prefix)) { numbered++; break; }
                }
            }
            if (phrases >= 2 || numbered >= 3) return ContentType.TUTORIAL;
        }
        return ContentType.BLOG;
    }

    private static String lower(String s) {
        return s == null ? "" : s.toLowerCase(Locale.ROOT);
    }
}
