package net.morkit.table;

/**
 * Thrown when table rows cannot be turned back into dictionary entries.
 */
public class ProjectionException extends Exception {

    private final RowKey rowKey;

    public ProjectionException(RowKey rowKey, String message) {
        super((rowKey == null) ? message : rowKey + ": " + message);
        this.rowKey = rowKey;
    }
    public ProjectionException(RowKey rowKey, String message,
                               Throwable cause) {
        super((rowKey == null) ? message : rowKey + ": " + message, cause);
        this.rowKey = rowKey;
    }

    /**
     * The key of the offending row, or null.
     */
    public RowKey getRowKey() {
        return rowKey;
    }

}
