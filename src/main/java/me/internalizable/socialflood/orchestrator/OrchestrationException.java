package me.internalizable.socialflood.orchestrator;

/**
 * Base type for every failure {@link Orchestrator#execute} reports to endpoint handlers.
 */
public abstract class OrchestrationException extends Exception {

    protected OrchestrationException(String message) {
        super(message);
    }

    protected OrchestrationException(String message, Throwable cause) {
        super(message, cause);
    }
}
