package com.fiftyalert.dispatcher.domain.exceptions;

import java.nio.file.Path;

public class LedgerCommitException extends RuntimeException {

    private LedgerCommitException(String message, Throwable cause) {
        super(message, cause);
    }

    public static LedgerCommitException of(Path ledger, Throwable cause) {
        return new LedgerCommitException("Failed to commit delivery ledger " + ledger + ": " + cause.getMessage(), cause);
    }

    public static LedgerCommitException verificationFailed(Path artifact, String problem) {
        return new LedgerCommitException("Written ledger " + artifact + " failed re-validation: " + problem, null);
    }
}
