package com.tnpds.scraper;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ShopStatus {
    ONLINE("online"),
    OFFLINE("offline"),
    UNKNOWN("unknown");

    private final String value;

    ShopStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
