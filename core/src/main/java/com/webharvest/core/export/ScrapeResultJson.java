package com.webharvest.core.export;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.webharvest.core.model.ScrapeResult;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/** ScrapeResult ↔ JSON ({"site", "items":[...]}) */
public final class ScrapeResultJson {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    private ScrapeResultJson() {}

    public static String toJson(ScrapeResult result) throws IOException {
        return MAPPER.writeValueAsString(result);
    }

    public static void write(ScrapeResult result, Path out) throws IOException {
        Path parent = out.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        MAPPER.writeValue(out.toFile(), result);
    }

    public static ScrapeResult read(Path in) throws IOException {
        return MAPPER.readValue(in.toFile(), ScrapeResult.class);
    }
}
