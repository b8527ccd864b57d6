package com.webharvest.core.discovery;

import com.webharvest.core.api.IPageFetcher;
import com.webharvest.core.http.FetchException;
import com.webharvest.core.model.FetchResult;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/** URL 문자열 → 고정 응답. 스텁 없는 URL 은 404. */
final class FakeFetcher implements IPageFetcher {

    private record Stub(int status, String body, String contentType, FetchException error) {}

    private final Map<String, Stub> byUrl = new ConcurrentHashMap<>();
    final List<String> requested = Collections.synchronizedList(new ArrayList<>());

    FakeFetcher stub(String url, int status, String body) {
        return stub(url, status, body, "text/html; charset=utf-8");
    }

    FakeFetcher stub(String url, int status, String body, String contentType) {
        byUrl.put(url, new Stub(status, body, contentType, null));
        return this;
    }

    FakeFetcher fail(String url, FetchException.Kind kind) {
        byUrl.put(url, new Stub(0, "", null,
                new FetchException(kind, URI.create(url), "stubbed " + kind)));
        return this;
    }

    @Override
    public FetchResult fetch(URI uri, Duration timeout) throws FetchException {
        requested.add(uri.toString());
        Stub s = byUrl.get(uri.toString());
        if (s == null) return FetchResult.builder().requestUri(uri).status(404).build();
        if (s.error() != null) throw s.error();
        return FetchResult.builder()
                .requestUri(uri)
                .status(s.status())
                .contentType(s.contentType())
                .body(s.body())
                .build();
    }
}
