package com.webharvest.core.http;

import java.io.IOException;
import java.net.URI;

/** 네트워크 수준 수집 실패(타임아웃/연결/인터럽트). HTTP 상태 오류는 포함하지 않는다. */
public class FetchException extends IOException {

    public enum Kind { TIMEOUT, CONNECTION, INTERRUPTED }

    private final Kind kind;
    private final URI uri;

    public FetchException(Kind kind, URI uri, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.uri = uri;
    }

    public FetchException(Kind kind, URI uri, String message) {
        this(kind, uri, message, null);
    }

    public Kind getKind() { return kind; }
    public URI getUri() { return uri; }
}
