package com.shlokmestry.campaignbridge.api;

public class NotAuthenticatedException extends RuntimeException {

    public NotAuthenticatedException(String action) {
        super("User not authenticated for " + action);
    }
}
