package com.webharvest.core.model;

import java.net.URI;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/** 단건 HTTP 응답 DTO. body 는 원본 바이트 그대로 보관 */
public final class FetchResult {
    private final URI requestUri;
    private final URI finalUri;
    private final int status;
    private final byte[] body;
    private final String contentType;
    private final Map<String, List<String>> headers; // 키: 대소문자 무시
    private final long elapsedMs;

    private FetchResult(Builder b) {
        this.requestUri = Objects.requireNonNull(b.requestUri, "requestUri");
        this.finalUri = (b.finalUri != null ? b.finalUri : b.requestUri);
        this.status = b.status;
        this.body = (b.body != null ? b.body : new byte[0]);
        this.contentType = b.contentType;
        Map<String, List<String>> h = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (b.headers != null) {
            b.headers.forEach((k, v) -> { if (k != null) h.put(k, v == null ? List.of() : List.copyOf(v)); });
        }
        this.headers = h;
        this.elapsedMs = b.elapsedMs;
    }

    public static Builder builder() { return new Builder(); }

    public URI getRequestUri() { return requestUri; }
    public URI getFinalUri() { return finalUri; }
    public int getStatus() { return status; }
    public byte[] getBody() { return body; }
    public String getContentType() { return contentType; }
    public Map<String, List<String>> getHeaders() { return headers; }
    public long getElapsedMs() { return elapsedMs; }

    public boolean isOk() { return status == 200; }

    public Optional<String> header(String name) {
        List<String> v = headers.get(name);
        return (v == null || v.isEmpty()) ? Optional.empty() : Optional.ofNullable(v.get(0));
    }

    /** Content-Type charset 우선, 없으면 UTF-8 */
    public String text() {
        return new String(body, charset());
    }

    private Charset charset() {
        if (contentType == null) return StandardCharsets.UTF_8;
        for (String part : contentType.split(";")) {
            String p = part.trim().toLowerCase(Locale.ROOT);
            if (p.startsWith("charset=")) {
                String cs = p.substring("charset=".length()).replace("\"", "").trim();
                try {
                    return Charset.forName(cs);
                } catch (IllegalArgumentException e) {
                    return StandardCharsets.UTF_8;
                }
            }
        }
        return StandardCharsets.UTF_8;
    }

    public static final class Builder {
        private URI requestUri;
        private URI finalUri;
        private int status;
        private byte[] body;
        private String contentType;
        private Map<String, List<String>> headers;
        private long elapsedMs;

        public Builder requestUri(URI v) { this.requestUri = v; return this; }
        public Builder finalUri(URI v) { this.finalUri = v; return this; }
        public Builder status(int v) { this.status = v; return this; }
        public Builder body(byte[] v) { this.body = v; return this; }
        public Builder body(String v) { this.body = (v == null ? null : v.getBytes(StandardCharsets.UTF_8)); return this; }
        public Builder contentType(String v) { this.contentType = v; return this; }
        public Builder headers(Map<String, List<String>> v) { this.headers = v; return this; }
        public Builder elapsedMs(long v) { this.elapsedMs = v; return this; }

        public FetchResult build() { return new FetchResult(this); }
    }
}
