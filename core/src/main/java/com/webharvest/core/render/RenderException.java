package com.webharvest.core.render;

/** 브라우저 렌더 실패(탐색 타임아웃, 브라우저 오류 등) */
public class RenderException extends Exception {
    private final String url;

    public RenderException(String url, String message, Throwable cause) {
        super(message + ": " + url, cause);
        this.url = url;
    }

    public RenderException(String url, String message) {
        this(url, message, null);
    }

    public String getUrl() { return url; }
}
