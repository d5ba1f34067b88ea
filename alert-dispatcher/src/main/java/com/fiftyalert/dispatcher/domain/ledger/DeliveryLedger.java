package com.fiftyalert.dispatcher.domain.ledger;

import com.fiftyalert.dispatcher.domain.exceptions.LedgerCommitException;
import com.fiftyalert.dispatcher.domain.exceptions.LedgerCorruptedException;

import java.util.Collection;

/**
 * Domain port for the durable record of dispatched alert keys.
 * Keys are only ever added; removal is a manual repair.
 */
public interface DeliveryLedger {

    /**
     * @return the persisted state, or an empty ledger when nothing has been persisted yet
     * @throws LedgerCorruptedException when a persisted ledger exists but is structurally invalid
     */
    LedgerState load();

    /**
     * Atomically persists the ledger with {@code newKeys} added.
     *
     * @return the state as written
     * @throws LedgerCommitException when the new state could not be durably written and verified
     */
    LedgerState commit(Collection<String> newKeys);
}
