package com.Unthinkable.TaskAssigner.engine;

/**
 * Raised when a run is started without anyone to assign tasks to. Fatal for the whole batch.
 */
public class EmptyRosterException extends RuntimeException {

    public EmptyRosterException() {
        super("No team members found. Please add team members first.");
    }
}
