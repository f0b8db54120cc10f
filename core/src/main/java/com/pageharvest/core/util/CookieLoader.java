package com.pageharvest.core.util;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pageharvest.core.model.CookieSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/** 쿠키 JSON 배열 파일 로더. 파일이 없거나 깨졌으면 경고 후 빈 목록. */
public final class CookieLoader {
    private static final Logger LOG = LoggerFactory.getLogger(CookieLoader.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private CookieLoader() {}

    public static List<CookieSpec> load(Path file) {
        if (file == null) return List.of();
        if (!Files.exists(file)) {
            LOG.warn("Failed to load cookies from {}: file not found", file);
            return List.of();
        }
        try {
            List<CookieSpec> cookies = MAPPER.readValue(file.toFile(), new TypeReference<List<CookieSpec>>() {});
            List<CookieSpec> valid = cookies.stream()
                    .filter(c -> c != null && c.name() != null && c.value() != null)
                    .toList();
            LOG.info("Loaded {} cookies from {}", valid.size(), file);
            return valid;
        } catch (IOException e) {
            LOG.warn("Failed to load cookies from {}: {}", file, e.getMessage());
            return List.of();
        }
    }
}
