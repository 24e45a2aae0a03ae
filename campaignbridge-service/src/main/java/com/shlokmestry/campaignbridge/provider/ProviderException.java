package com.shlokmestry.campaignbridge.provider;

public class ProviderException extends RuntimeException {

    private final String code;
    private final int status;

    public ProviderException(String code, String message, int status) {
        super(message);
        this.code = code;
        this.status = status;
    }

    public ProviderException(String code, String message, int status, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.status = status;
    }

    public static ProviderException badRequest(String code, String message) {
        return new ProviderException(code, message, 400);
    }

    public String code() {
        return code;
    }

    public int status() {
        return status;
    }
}
