package com.underscoreresearch.keystore.identity;

import java.util.List;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import com.google.common.base.Splitter;

/**
 * A username on an external service, written <code>username@service</code>.
 */
@Getter
@EqualsAndHashCode
public final class ServiceIdentifier {
    private static final Splitter AT_SPLITTER = Splitter.on('@');

    private final Service service;
    private final String username;

    public ServiceIdentifier(Service service, String username) {
        if (username == null || username.isEmpty()) {
            throw new IllegalArgumentException("Username must not be empty");
        }
        this.service = service;
        this.username = username;
    }

    public static ServiceIdentifier parse(String identifier) throws ServiceParseException {
        List<String> parts = AT_SPLITTER.splitToList(identifier);
        if (parts.size() != 2 || parts.get(0).isEmpty() || parts.get(1).isEmpty()) {
            throw ServiceParseException.invalid();
        }
        Service service = Service.fromName(parts.get(1));
        if (service == null) {
            throw ServiceParseException.unknown(parts.get(1));
        }
        return new ServiceIdentifier(service, parts.get(0));
    }

    @Override
    public String toString() {
        return username + "@" + service.getName();
    }
}
