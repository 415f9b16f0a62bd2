package org.iceforge.warden.audit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Writes audit records to the {@code warden.audit} logger. SQL text is included only at DEBUG. */
public class LoggingAuditSink implements AuditSink {
    private static final Logger audit = LoggerFactory.getLogger("warden.audit");

    @Override
    public void record(AuditRecord r) {
        if (r.errorKind() == null) {
            audit.info("user={} status={} rows={} timeMs={} cached={}", r.userId(), r.status().wireName(),
                    r.rowCount(), r.executionTimeMs(), r.cached());
        } else {
            audit.info("user={} status={} error={} state={} message=\"{}\"", r.userId(), r.status().wireName(),
                    r.errorKind().wireName(), r.finalState(), r.errorMessage());
        }
        if (audit.isDebugEnabled()) {
            audit.debug("user={} sql={}", r.userId(), r.sql());
        }
    }
}
