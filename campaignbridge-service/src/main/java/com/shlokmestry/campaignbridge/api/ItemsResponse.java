package com.shlokmestry.campaignbridge.api;

import java.util.List;

public record ItemsResponse<T>(List<T> items) {}
