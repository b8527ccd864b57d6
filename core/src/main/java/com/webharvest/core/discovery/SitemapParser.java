package com.webharvest.core.discovery;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;
import org.jsoup.select.Elements;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.Predicate;

/**
 * 사이트맵 XML 한 건 파서(jsoup XML 모드).
 * - index: 중첩 sitemap loc 최대 3개
 * - urlset: 최대 2,000 개 처리, 채택 1,000 개 도달 시 조기 종료
 * - lastmod 내림차순(날짜 없음은 뒤) 정렬 후 상위 100 개
 */
public final class SitemapParser {

    public static final int MAX_NESTED_PER_INDEX = 3;
    public static final int MAX_PROCESSED_ENTRIES = 2_000;
    public static final int EARLY_STOP_ACCEPTED = 1_000;
    public static final int MAX_RETURNED = 100;

    /** 파싱 결과 */
    public record Result(List<String> nestedSitemaps, List<String> urls, int processedEntries) {}

    private record Entry(String loc, LocalDate lastmod, int order) {}

    private SitemapParser() {}

    public static Result parse(String xml, Predicate<String> accept) {
        Document doc = Jsoup.parse(xml == null ? "" : xml, "", Parser.xmlParser());

        // ---- 1) sitemap index ----
        List<String> nested = new ArrayList<>();
        for (Element sm : doc.getElementsByTag("sitemap")) {
            if (nested.size() >= MAX_NESTED_PER_INDEX) break;
            String loc = childText(sm, "loc");
            if (!loc.isEmpty()) nested.add(loc);
        }

        // ---- 2) urlset ----
        Elements urlTags = doc.getElementsByTag("url");
        List<Entry> accepted = new ArrayList<>();
        int processed = 0;
        for (Element u : urlTags) {
            if (processed >= MAX_PROCESSED_ENTRIES) break;
            if (accepted.size() >= EARLY_STOP_ACCEPTED) break;
            processed++;

            String loc = childText(u, "loc");
            if (loc.isEmpty() || !accept.test(loc)) continue;
            accepted.add(new Entry(loc, parseDate(childText(u, "lastmod")), accepted.size()));
        }

        accepted.sort(Comparator
                .comparing(Entry::lastmod, Comparator.nullsLast(Comparator.<LocalDate>reverseOrder()))
                .thenComparingInt(Entry::order));

        List<String> urls = new ArrayList<>(Math.min(accepted.size(), MAX_RETURNED));
        for (Entry e : accepted) {
            if (urls.size() >= MAX_RETURNED) break;
            urls.add(e.loc());
        }
        return new Result(List.copyOf(nested), List.copyOf(urls), processed);
    }

    private static String childText(Element parent, String tag) {
        Element c = parent.getElementsByTag(tag).first();
        return c == null ? "" : c.text().trim();
    }

    /** "2024-03-01T10:00:00Z" → 날짜 부분만. 해석 실패 시 null */
    static LocalDate parseDate(String s) {
        if (s == null || s.isBlank()) return null;
        String d = s.trim();
        int t = d.indexOf('T');
        if (t > 0) d = d.substring(0, t);
        try {
            return LocalDate.parse(d);
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
