package io.assistify.core.observability;

import java.io.IOException;
import java.util.List;

public interface AuditStore {
    void append(AuditEvent event) throws IOException;

    List<AuditEvent> load() throws IOException;

    void replace(List<AuditEvent> events) throws IOException;
}
