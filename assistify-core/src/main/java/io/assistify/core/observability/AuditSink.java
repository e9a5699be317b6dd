package io.assistify.core.observability;

import java.io.IOException;
import java.util.Map;

@FunctionalInterface
public interface AuditSink {
    AuditSink NOOP = (type, attributes) -> {
    };

    void record(String type, Map<String, Object> attributes) throws IOException;
}
