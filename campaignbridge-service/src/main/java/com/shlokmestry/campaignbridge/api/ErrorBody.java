package com.shlokmestry.campaignbridge.api;

public record ErrorBody(String code, String message) {}
