package com.clickermsu.registry.exception;

public class InvalidRequestException extends RegistryException {
    public InvalidRequestException(String message) {
        super(message, "INVALID_REQUEST");
    }
}
