package org.optimax.rogue.runtime.update;

/**
 * Thrown when a client view cannot apply an update record, typically because the record names
 * an entity or modifier the view does not hold. The transport answers with a full resync.
 */
public class DesyncException extends RuntimeException {

    private final long order;

    public DesyncException(long order, String message) {
        super("Desync at update " + order + ": " + message);
        this.order = order;
    }

    public DesyncException(long order, String message, Throwable cause) {
        super("Desync at update " + order + ": " + message, cause);
        this.order = order;
    }

    /**
     * @return the order of the record that could not be applied
     */
    public long getOrder() {
        return order;
    }
}
