package com.fiftyalert.dispatcher.domain.exceptions;

import java.nio.file.Path;

/**
 * The persisted ledger exists but cannot be trusted. Never recovered automatically:
 * an empty substitute would re-deliver every event already sent.
 */
public class LedgerCorruptedException extends RuntimeException {

    private final transient Path preservedCopy;

    private LedgerCorruptedException(String message, Path preservedCopy, Throwable cause) {
        super(message, cause);
        this.preservedCopy = preservedCopy;
    }

    public static LedgerCorruptedException of(Path ledger, String problem, Path preservedCopy) {
        var where = preservedCopy != null ? ", corrupt copy preserved at " + preservedCopy : ", corrupt copy could not be preserved";
        return new LedgerCorruptedException(
                "Delivery ledger " + ledger + " is corrupted: " + problem + where, preservedCopy, null);
    }

    public static LedgerCorruptedException unreadable(Path ledger, Throwable cause) {
        return new LedgerCorruptedException("Delivery ledger " + ledger + " could not be read", null, cause);
    }

    public Path preservedCopy() {
        return preservedCopy;
    }
}
