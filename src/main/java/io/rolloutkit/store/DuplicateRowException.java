package io.rolloutkit.store;

public final class DuplicateRowException extends RuntimeException {
    private final String rowId;

    public DuplicateRowException(String rowId) {
        super("Duplicate Row ID " + rowId + " already exists");
        this.rowId = rowId;
    }

    public String rowId() {
        return rowId;
    }
}
