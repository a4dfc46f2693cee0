package com.cmagents.security;

public class ApiKeyRequiredException extends RuntimeException {

    public ApiKeyRequiredException(String message) {
        super(message);
    }
}
