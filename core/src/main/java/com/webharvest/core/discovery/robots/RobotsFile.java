package com.webharvest.core.discovery.robots;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * robots.txt 파싱 결과.
 * - Sitemap: 지시어는 그룹과 무관하게 전역 수집
 * - User-agent 연속 라인은 같은 그룹, 이후 Allow/Disallow 누적
 * - 판정: 가장 긴 매칭 규칙 우선, 길이 같으면 Allow 우선. '*' / '$' 와일드카드 지원
 */
public final class RobotsFile {

    private static final Pattern KV = Pattern.compile("^\\s*([A-Za-z-]+)\\s*:\\s*(.*?)\\s*$");
    private static final String UA_ALL = "*";

    /** 비어있는(전부 허용) robots */
    public static final RobotsFile EMPTY = new RobotsFile(List.of(), Map.of());

    private record Rule(String pattern, boolean allow) {}

    private final List<String> sitemaps;
    private final Map<String, List<Rule>> rulesByAgent;   // UA 소문자 → 규칙

    private RobotsFile(List<String> sitemaps, Map<String, List<Rule>> rulesByAgent) {
        this.sitemaps = List.copyOf(sitemaps);
        this.rulesByAgent = rulesByAgent;
    }

    public static RobotsFile parse(String text) {
        if (text == null || text.isBlank()) return EMPTY;

        Set<String> sitemaps = new LinkedHashSet<>();
        Map<String, List<Rule>> byAgent = new LinkedHashMap<>();
        List<String> group = new ArrayList<>();
        boolean lastWasAgent = false;

        for (String raw : text.split("\\r?\\n")) {
            int hash = raw.indexOf('#');
            String line = (hash >= 0 ? raw.substring(0, hash) : raw).trim();
            if (line.isEmpty()) continue;

            Matcher m = KV.matcher(line);
            if (!m.matches()) continue;
            String key = m.group(1).toLowerCase(Locale.ROOT);
            String val = m.group(2);

            switch (key) {
                case "sitemap" -> {
                    // "Sitemap: https://..." 의 콜론 분리로 값이 잘리지 않도록 원문에서 다시 자름
                    int c = line.indexOf(':');
                    String url = line.substring(c + 1).trim();
                    if (!url.isEmpty()) sitemaps.add(url);
                }
                case "user-agent" -> {
                    if (!lastWasAgent) group = new ArrayList<>();
                    String ua = (val.isEmpty() ? UA_ALL : val.toLowerCase(Locale.ROOT));
                    group.add(ua);
                    byAgent.putIfAbsent(ua, new ArrayList<>());
                    lastWasAgent = true;
                    continue;
                }
                case "allow", "disallow" -> {
                    if (group.isEmpty()) {
                        group.add(UA_ALL);
                        byAgent.putIfAbsent(UA_ALL, new ArrayList<>());
                    }
                    if (!val.isEmpty()) {
                        Rule r = new Rule(val, key.equals("allow"));
                        for (String ua : group) byAgent.get(ua).add(r);
                    }
                }
                default -> { /* crawl-delay 등 무시 */ }
            }
            lastWasAgent = false;
        }
        return new RobotsFile(new ArrayList<>(sitemaps), byAgent);
    }

    public List<String> sitemaps() { return sitemaps; }

    /** userAgent 정확 일치 그룹 → 없으면 '*' 그룹 → 없으면 전부 허용 */
    public boolean isAllowed(String userAgentToken, String pathAndQuery) {
        String path = (pathAndQuery == null || pathAndQuery.isEmpty()) ? "/" : pathAndQuery;
        List<Rule> rules = null;
        if (userAgentToken != null) rules = rulesByAgent.get(userAgentToken.toLowerCase(Locale.ROOT));
        if (rules == null) rules = rulesByAgent.get(UA_ALL);
        if (rules == null || rules.isEmpty()) return true;

        Rule best = null;
        for (Rule r : rules) {
            if (!matches(r.pattern(), path)) continue;
            if (best == null
                    || r.pattern().length() > best.pattern().length()
                    || (r.pattern().length() == best.pattern().length() && r.allow() && !best.allow())) {
                best = r;
            }
        }
        return best == null || best.allow();
    }

    static boolean matches(String pattern, String path) {
        boolean anchored = pattern.endsWith("$");
        String p = anchored ? pattern.substring(0, pattern.length() - 1) : pattern;
        StringBuilder re = new StringBuilder("^");
        for (String part : p.split("\\*", -1)) {
            if (re.length() > 1) re.append(".*");
            re.append(Pattern.quote(part));
        }
        if (anchored) re.append('$');
        return Pattern.compile(re.toString()).matcher(path).find();
    }
}
