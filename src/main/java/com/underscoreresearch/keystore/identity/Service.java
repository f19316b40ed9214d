package com.underscoreresearch.keystore.identity;

import lombok.Getter;

/**
 * External services an account can be linked to.
 */
public enum Service {
    GITHUB("github");

    @Getter
    private final String name;

    Service(String name) {
        this.name = name;
    }

    public static Service fromName(String name) {
        for (Service service : values()) {
            if (service.name.equals(name)) {
                return service;
            }
        }
        return null;
    }
}
