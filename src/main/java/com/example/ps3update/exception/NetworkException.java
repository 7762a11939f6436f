package com.example.ps3update.exception;

public class NetworkException extends Ps3UpdateException {

    public NetworkException(String message, Throwable cause) {
        super("Network error: " + message, cause);
    }
}
