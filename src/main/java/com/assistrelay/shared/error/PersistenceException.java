package com.assistrelay.shared.error;

public class PersistenceException extends RelayException {

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
