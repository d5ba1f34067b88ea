package com.fiftyalert.dispatcher.domain.dispatch;

public sealed interface DispatchOutcome {

    static DispatchOutcome delivered() {
        return new Delivered();
    }

    static DispatchOutcome alreadyDelivered() {
        return new AlreadyDelivered();
    }

    static DispatchOutcome failed(String reason) {
        return new Failed(reason);
    }

    record Delivered() implements DispatchOutcome {
    }

    /** Counted as success, but not as a new delivery. */
    record AlreadyDelivered() implements DispatchOutcome {
    }

    record Failed(String reason) implements DispatchOutcome {
    }
}
