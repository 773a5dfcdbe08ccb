package tech.yump.cendre.audit;

/**
 * Interface for audit logging backends.
 */
public interface AuditBackend {

    /**
     * Records a given audit event. Implementations decide where it goes (console, dedicated file, ...).
     *
     * @param event The AuditEvent to log. Must not be null.
     */
    void logEvent(AuditEvent event);

}
