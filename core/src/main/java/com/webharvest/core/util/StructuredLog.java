package com.webharvest.core.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Instant;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * JSON 라인 기반 구조화 로거 (java.util.logging 위에 얹음).
 * 이벤트 이름 + key/value 쌍을 한 줄 JSON 으로 남긴다.
 */
public final class StructuredLog {
    private static final ObjectMapper JSON = new ObjectMapper();

    private final Logger jul;
    private final String comp;

    private StructuredLog(Class<?> cls) {
        this.jul = Logger.getLogger(cls.getName());
        this.comp = cls.getSimpleName();
    }

    public static StructuredLog get(Class<?> cls) {
        return new StructuredLog(cls);
    }

    public void debug(String event, Object... kvs) { log(Level.FINE, event, null, kvs); }
    public void info (String event, Object... kvs) { log(Level.INFO, event, null, kvs); }
    public void warn (String event, Object... kvs) { log(Level.WARNING, event, null, kvs); }
    public void error(String event, Throwable t, Object... kvs) { log(Level.SEVERE, event, t, kvs); }

    private void log(Level lvl, String event, Throwable t, Object... kvs) {
        if (!jul.isLoggable(lvl)) return;
        String line = toJsonLine(lvl, event, t, kvs);
        if (t == null) jul.log(lvl, line); else jul.log(lvl, line, t);
    }

    /** 테스트에서 포맷 확인용으로 패키지 공개 */
    String toJsonLine(Level lvl, String event, Throwable t, Object... kvs) {
        ObjectNode node = JSON.createObjectNode();
        node.put("ts", Instant.now().toString());
        node.put("lvl", lvl.getName());
        node.put("comp", comp);
        node.put("thread", Thread.currentThread().getName());
        node.put("event", event);

        if (kvs != null) {
            for (int i = 0; i + 1 < kvs.length; i += 2) {
                put(node, String.valueOf(kvs[i]), kvs[i + 1]);
            }
            if (kvs.length % 2 == 1) node.put("_kv_mismatch", true);
        }
        if (t != null) {
            node.put("error", t.getClass().getSimpleName());
            node.put("message", t.getMessage());
        }
        try {
            return JSON.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            // ObjectNode 직렬화는 사실상 실패하지 않음
            return "{\"event\":\"" + event + "\",\"_serialize_error\":true}";
        }
    }

    private static void put(ObjectNode node, String k, Object v) {
        if (v == null) node.putNull(k);
        else if (v instanceof Integer i) node.put(k, i);
        else if (v instanceof Long l) node.put(k, l);
        else if (v instanceof Double d) node.put(k, d);
        else if (v instanceof Boolean b) node.put(k, b);
        else if (v instanceof Number n) node.put(k, n.doubleValue());
        else node.put(k, String.valueOf(v));
    }
}
