package com.pageharvest.app;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.pageharvest.core.model.HttpResponseData;
import com.pageharvest.core.model.ResultRecord;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/** 결과를 JSON 배열 파일로 기록 */
final class ResultsWriter {
    private static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private ResultsWriter() {}

    static void write(List<ResultRecord> results, Path out) throws IOException {
        Path parent = out.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        MAPPER.writeValue(out.toFile(), toJson(results));
    }

    static ArrayNode toJson(List<ResultRecord> results) {
        ArrayNode arr = MAPPER.createArrayNode();
        for (ResultRecord r : results) arr.add(toJson(r));
        return arr;
    }

    static ObjectNode toJson(ResultRecord r) {
        ObjectNode n = MAPPER.createObjectNode();
        n.put("identity", r.getIdentity());
        n.put("url", r.getUrl() == null ? null : r.getUrl().toString());
        n.put("status", r.getStatus().name());
        n.put("retriesUsed", r.getRetriesUsed());
        if (r.isSuccess()) {
            Object p = r.getPayload();
            if (p instanceof HttpResponseData h) {
                n.set("payload", httpPayload(h));
            } else {
                n.set("payload", MAPPER.valueToTree(p));
            }
        } else {
            ObjectNode err = n.putObject("error");
            err.put("kind", String.valueOf(r.getErrorKind()));
            err.put("message", r.getErrorMessage());
        }
        return n;
    }

    private static ObjectNode httpPayload(HttpResponseData h) {
        ObjectNode p = MAPPER.createObjectNode();
        if (h.getRequestId() != null) p.put("requestId", h.getRequestId());
        p.put("statusCode", h.getStatusCode());
        p.put("contentType", h.getContentType());
        p.put("responseTimeMs", h.getResponseTimeMs());
        if (h.isJson()) p.set("json", h.getJson());
        else p.put("text", h.getText());
        return p;
    }
}
