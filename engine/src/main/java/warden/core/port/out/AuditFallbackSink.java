package warden.core.port.out;

import warden.core.model.audit.AuditLogEntry;

/**
 * Last-resort destination for audit entries the repository could not persist.
 */
public interface AuditFallbackSink {

    /**
     * Write an entry locally. Implementations must not throw.
     *
     * @param entry the entry that failed to persist
     * @param cause why persistence failed
     */
    void write(AuditLogEntry entry, Throwable cause);

    /**
     * @return number of entries written since startup
     */
    long writeCount();
}
