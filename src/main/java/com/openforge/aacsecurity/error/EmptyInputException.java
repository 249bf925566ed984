package com.openforge.aacsecurity.error;

public class EmptyInputException extends IllegalArgumentException {

    public EmptyInputException(String message) {
        super(message);
    }
}
