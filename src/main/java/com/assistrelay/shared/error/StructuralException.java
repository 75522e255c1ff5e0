package com.assistrelay.shared.error;

public class StructuralException extends RelayException {

    public StructuralException(String message) {
        super(message);
    }
}
