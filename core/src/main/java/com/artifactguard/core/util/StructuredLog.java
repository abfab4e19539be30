package com.artifactguard.core.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Instant;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * JSON 라인 기반 구조화 로거 (에셋 단위 이벤트용).
 * LogSetup(콘솔/파일 핸들러) 세팅 후 여기서 호출하면 한 줄 JSON으로 찍힘.
 */
public final class StructuredLog {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Logger jul;
    private final String comp;

    private StructuredLog(Class<?> cls) {
        this.jul = Logger.getLogger(cls.getName());
        this.comp = cls.getSimpleName();
    }

    public static StructuredLog get(Class<?> cls) {
        return new StructuredLog(cls);
    }

    public void debug(String event, Object... kvs) { log(Level.FINE,   event, null, kvs); }
    public void info (String event, Object... kvs) { log(Level.INFO,   event, null, kvs); }
    public void warn (String event, Object... kvs) { log(Level.WARNING,event, null, kvs); }
    public void error(String event, Throwable t, Object... kvs) { log(Level.SEVERE, event, t, kvs); }

    private void log(Level lvl, String event, Throwable t, Object... kvs) {
        if (!jul.isLoggable(lvl)) return;
        String line = line(lvl, event, t, kvs);
        if (t == null) jul.log(lvl, line); else jul.log(lvl, line, t);
    }

    String line(Level lvl, String event, Throwable t, Object... kvs) {
        ObjectNode n = MAPPER.createObjectNode();
        n.put("ts", Instant.now().toString());
        n.put("lvl", lvl.getName());
        n.put("comp", comp);
        n.put("event", event);

        if (kvs != null) {
            for (int i = 0; i + 1 < kvs.length; i += 2) {
                put(n, String.valueOf(kvs[i]), kvs[i + 1]);
            }
            if (kvs.length % 2 == 1) n.put("_kv_mismatch", true);
        }
        if (t != null) {
            n.put("error", t.getClass().getSimpleName());
            n.put("message", t.getMessage());
        }
        try {
            return MAPPER.writeValueAsString(n);
        } catch (JsonProcessingException e) {
            // 직렬화 실패 시 이벤트 이름만 남김
            return "{\"event\":\"" + event + "\",\"_serialization_error\":true}";
        }
    }

    private static void put(ObjectNode n, String k, Object v) {
        if (v == null) n.putNull(k);
        else if (v instanceof Integer i) n.put(k, i);
        else if (v instanceof Long l) n.put(k, l);
        else if (v instanceof Double d) n.put(k, d);
        else if (v instanceof Boolean b) n.put(k, b);
        else n.put(k, String.valueOf(v));
    }
}
