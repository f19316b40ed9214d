package com.underscoreresearch.keystore.identity;

import lombok.Getter;

public class ServiceParseException extends Exception {
    public enum Reason {
        INVALID,
        UNKNOWN
    }

    @Getter
    private final Reason reason;
    @Getter
    private final String serviceName;

    private ServiceParseException(Reason reason, String serviceName, String message) {
        super(message);
        this.reason = reason;
        this.serviceName = serviceName;
    }

    public static ServiceParseException invalid() {
        return new ServiceParseException(Reason.INVALID, null,
                "Expected a service description of the form username@service.");
    }

    public static ServiceParseException unknown(String serviceName) {
        return new ServiceParseException(Reason.UNKNOWN, serviceName,
                String.format("Unknown service '%s'", serviceName));
    }
}
