package com.webharvest.core.discovery;

import com.webharvest.core.api.IRenderer;
import com.webharvest.core.render.RenderException;
import com.webharvest.core.util.UrlUtils;

import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/** 6단계(폴백, 브라우저 모드 전용): 렌더러 링크 탐색 결과 중 같은 호스트 URL. */
public final class BrowserDiscovery implements DiscoveryStage {

    private final IRenderer renderer;

    public BrowserDiscovery(IRenderer renderer) {
        this.renderer = Objects.requireNonNull(renderer, "renderer");
    }

    @Override public String name() { return "browser"; }
    @Override public boolean isFallback() { return true; }

    @Override
    public Set<String> discover(DiscoveryContext ctx) throws DiscoveryException {
        Set<String> links;
        try {
            links = renderer.discoverLinks(ctx.base().toString());
        } catch (RenderException e) {
            throw new DiscoveryException(name(), "renderer link discovery failed", e);
        }
        Set<String> out = new LinkedHashSet<>();
        for (String l : links) {
            String clean = UrlUtils.stripFragment(l);
            if (clean != null && ctx.heuristic().isSameHost(clean)) out.add(clean);
        }
        return out;
    }
}
