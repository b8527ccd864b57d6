package com.webharvest.core.process;

import com.webharvest.core.model.ContentItem;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ChunkerTest {

    private static ContentItem item(String content) {
        return new ContentItem("Long Read", content, null, "https://example.com/blog/long");
    }

    /** 길이 len 의 문단 n 개를 "\n\n" 로 연결 */
    private static String paragraphs(int n, int len) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < n; i++) {
            if (i > 0) sb.append("\n\n");
            sb.append(String.valueOf((char) ('a' + i % 26)).repeat(len));
        }
        return sb.toString();
    }

    @Test
    void content_up_to_one_and_a_half_chunk_sizes_is_untouched() {
        ContentItem it = item(paragraphs(3, 1000));   // 3004 chars
        assertThat(new Chunker(2100).split(it)).containsExactly(it);
        assertThat(new Chunker(8000).split(it)).containsExactly(it);
    }

    @Test
    void splits_on_paragraph_boundaries_and_reconstructs() {
        String content = paragraphs(6, 1500);          // 9010 chars
        List<ContentItem> parts = new Chunker(4000).split(item(content));

        assertThat(parts).hasSize(3);
        assertThat(parts).extracting(ContentItem::getTitle)
                .containsExactly("Long Read (Part 1)", "Long Read (Part 2)", "Long Read (Part 3)");
        assertThat(parts).allMatch(p -> p.getContent().length() <= 4000);
        assertThat(parts).allMatch(p -> p.getSourceUrl().equals("https://example.com/blog/long"));
        String rebuilt = parts.stream().map(ContentItem::getContent).collect(Collectors.joining("\n\n"));
        assertThat(rebuilt).isEqualTo(content);
    }

    @Test
    void more_than_three_chunks_keeps_original() {
        ContentItem it = item(paragraphs(8, 1500));
        assertThat(new Chunker(2000).split(it)).containsExactly(it);
    }

    @Test
    void tiny_chunk_keeps_original() {
        // 1500 + 1500 + 800: 마지막 조각 1000자 이하
        String content = "a".repeat(1500) + "\n\n" + "b".repeat(1500) + "\n\n" + "c".repeat(800);
        ContentItem it = item(content);
        assertThat(new Chunker(1600).split(it)).containsExactly(it);
    }

    @Test
    void single_unsplittable_paragraph_stays_whole_without_part_suffix() {
        ContentItem it = item("z".repeat(5000));
        List<ContentItem> out = new Chunker(1000).split(it);
        assertThat(out).hasSize(1);
        assertThat(out.get(0).getTitle()).isEqualTo("Long Read");
        assertThat(out.get(0).getContent()).hasSize(5000);
    }

    @Test
    void rejects_non_positive_size() {
        assertThatThrownBy(() -> new Chunker(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
