package com.delta.leadgen.leads.generation;

public class GeneratorNotConfiguredException extends RuntimeException {
    public GeneratorNotConfiguredException(String message) {
        super(message);
    }
}
