package com.delta.leadgen.leads.generation;

/**
 * The generation service answered, but its output could not be read as a company batch. Never retried.
 */
public class GenerationParseException extends RuntimeException {
    public GenerationParseException(String message) {
        super(message);
    }
}
