package me.golemcore.archivist.domain.model;

/**
 * Outcome of importing a {@link MemorySnapshot}.
 */
public record StateImportResult(boolean success, int ledgerItems, int archivedItems, String error) {

    public static StateImportResult ok(int ledgerItems, int archivedItems) {
        return new StateImportResult(true, ledgerItems, archivedItems, null);
    }

    public static StateImportResult failed(String error) {
        return new StateImportResult(false, 0, 0, error);
    }
}
