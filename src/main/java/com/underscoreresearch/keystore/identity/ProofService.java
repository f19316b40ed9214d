package com.underscoreresearch.keystore.identity;

import java.io.IOException;
import java.util.List;

/**
 * Access to the ownership proofs published on one external service. Implementations own the transport, this
 * project only talks to them through this interface.
 */
public interface ProofService {
    Service getService();

    /**
     * Checks a published proof and returns the account identifier it vouches for.
     */
    String verify(String username, String signature) throws IOException;

    /**
     * All account identifiers <code>username</code> has published proofs for.
     */
    List<String> resolve(String username) throws IOException;

    /**
     * Text the user publishes on the service to prove they control <code>accountId</code>.
     */
    String proof(String username, String accountId, String object, String signature);
}
