package com.delta.leadgen.leads.enhance;

public class EnhancementException extends RuntimeException {
    public EnhancementException(String message) {
        super(message);
    }
}
