package org.iceforge.warden.audit;

import java.util.List;

/**
 * Receives one record per finished request. Fire-and-forget: implementations should not block for long, and any
 * exception they throw is logged and otherwise ignored by the pipeline.
 */
public interface AuditSink {

    void record(AuditRecord record);

    static AuditSink fanOut(List<AuditSink> sinks) {
        List<AuditSink> copy = List.copyOf(sinks);
        return record -> {
            for (AuditSink s : copy) s.record(record);
        };
    }
}
