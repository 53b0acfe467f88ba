package com.vdbfuzz.ledger;

/** How a run ended. */
public enum RunStatus {
    COMPLETED,
    /** Stopped at a batch boundary because no service answered its health probe. */
    ABORTED_NO_REACHABLE_SERVICES
}
