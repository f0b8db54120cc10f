package com.pageharvest.app;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pageharvest.core.model.WorkItem;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 작업 파일 로더.
 * - JSON 배열: 원소는 URL 문자열 또는 {url, method, params, headers, body, requestId}
 * - 그 외: 한 줄에 URL 하나 (빈 줄, '#' 주석 무시)
 */
final class ItemsReader {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ItemsReader() {}

    static List<WorkItem> read(Path file) throws IOException {
        String text = Files.readString(file, StandardCharsets.UTF_8);
        String trimmed = text.strip();
        if (trimmed.startsWith("[")) return fromJson(trimmed, file);

        List<WorkItem> out = new ArrayList<>();
        int lineNo = 0;
        for (String line : text.split("\\R")) {
            lineNo++;
            String s = line.strip();
            if (s.isEmpty() || s.startsWith("#")) continue;
            try {
                out.add(WorkItem.ofUrl(s));
            } catch (IllegalArgumentException e) {
                throw new IOException(file + ":" + lineNo + ": invalid URL: " + s, e);
            }
        }
        return out;
    }

    private static List<WorkItem> fromJson(String json, Path file) throws IOException {
        JsonNode root = MAPPER.readTree(json);
        List<WorkItem> out = new ArrayList<>(root.size());
        int idx = 0;
        for (JsonNode n : root) {
            try {
                out.add(toItem(n));
            } catch (IllegalArgumentException | NullPointerException e) {
                throw new IOException(file + "[" + idx + "]: invalid item: " + e.getMessage(), e);
            }
            idx++;
        }
        return out;
    }

    static WorkItem toItem(JsonNode n) {
        if (n.isTextual()) return WorkItem.ofUrl(n.asText());
        if (!n.isObject()) throw new IllegalArgumentException("expected string or object, got " + n.getNodeType());

        String url = text(n, "url");
        if (url == null) throw new IllegalArgumentException("missing url");
        String requestId = text(n, "requestId");
        if (requestId == null) requestId = text(n, "request_id");

        return WorkItem.builder()
                .url(url)
                .method(text(n, "method"))
                .params(stringMap(n.get("params")))
                .headers(stringMap(n.get("headers")))
                .body(body(n.get("body")))
                .requestId(requestId)
                .build();
    }

    private static String text(JsonNode n, String field) {
        JsonNode v = n.get(field);
        return (v == null || v.isNull()) ? null : v.asText();
    }

    /** body가 객체/배열이면 JSON 문자열로 보낸다 */
    private static String body(JsonNode v) {
        if (v == null || v.isNull()) return null;
        return v.isValueNode() ? v.asText() : v.toString();
    }

    private static Map<String, String> stringMap(JsonNode v) {
        if (v == null || !v.isObject()) return null;
        Map<String, String> m = new LinkedHashMap<>();
        v.fields().forEachRemaining(e -> m.put(e.getKey(), e.getValue().isValueNode() ? e.getValue().asText() : e.getValue().toString()));
        return m;
    }
}
