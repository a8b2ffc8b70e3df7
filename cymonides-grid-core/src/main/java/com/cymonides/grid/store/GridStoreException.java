package com.cymonides.grid.store;

/**
 * Thrown when the backing node store cannot serve a query or update. Not retried inside
 * the core; callers may retry the whole command.
 */
public class GridStoreException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final String projectId;

    public GridStoreException(String message) {
        super(message);
        this.projectId = null;
    }

    public GridStoreException(String projectId, String message, Throwable cause) {
        super(message, cause);
        this.projectId = projectId;
    }

    public String getProjectId() {
        return projectId;
    }
}
