package com.example.collab.shared.audit;

/**
 * Fire-and-forget audit trail. Implementations never propagate failures to the caller.
 */
public interface AuditLogSink {

    void append(AuditEvent event);
}
