package com.webharvest.core.process;

import com.webharvest.core.model.ContentItem;

import java.util.ArrayList;
import java.util.List;

/**
 * 긴 본문을 문단("\n\n") 경계로 나눈다.
 * chunkSize*1.5 이하면 그대로. 분할 결과가 3개 초과이거나 1000자 이하 조각이 있으면 분할 포기.
 */
public final class Chunker {

    static final String SEPARATOR = "\n\n";
    static final int MAX_CHUNKS = 3;
    static final int MIN_CHUNK_CHARS = 1000;

    private final int chunkSize;

    public Chunker(int chunkSize) {
        if (chunkSize < 1) throw new IllegalArgumentException("chunkSize must be >= 1");
        this.chunkSize = chunkSize;
    }

    public List<ContentItem> split(ContentItem item) {
        String content = item.getContent();
        if (content.length() <= chunkSize * 1.5) return List.of(item);

        List<String> chunks = pack(content);
        if (chunks.size() > MAX_CHUNKS) return List.of(item);
        for (String c : chunks) {
            if (c.length() <= MIN_CHUNK_CHARS) return List.of(item);
        }
        if (chunks.size() == 1) return List.of(item.withContent(chunks.get(0)));

        List<ContentItem> out = new ArrayList<>(chunks.size());
        for (int i = 0; i < chunks.size(); i++) {
            out.add(item.withTitle(item.getTitle() + " (Part " + (i + 1) + ")")
                        .withContent(chunks.get(i)));
        }
        return out;
    }

    /** 문단 단위 탐욕 적재. 구분자 2자를 길이에 포함한다. */
    List<String> pack(String content) {
        List<String> chunks = new ArrayList<>();
        StringBuilder cur = null;
        for (String para : content.split(SEPARATOR, -1)) {
            if (cur != null && cur.length() + SEPARATOR.length() + para.length() > chunkSize) {
                chunks.add(cur.toString());
                cur = null;
            }
            if (cur == null) {
                cur = new StringBuilder(para);
            } else {
                cur.append(SEPARATOR).append(para);
            }
        }
        if (cur != null) chunks.add(cur.toString());
        return chunks;
    }
}
