package org.conflux.scenario;

/**
 * Thrown when a scenario file cannot be read or describes an invalid economy.
 */
public class ScenarioException extends Exception {

    public ScenarioException(String message) {
        super(message);
    }

    public ScenarioException(String message, Throwable cause) {
        super(message, cause);
    }
}
