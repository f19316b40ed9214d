package com.underscoreresearch.keystore.identity;

import static com.underscoreresearch.keystore.utils.EncodingUtils.encodeHex;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import lombok.extern.slf4j.Slf4j;

import com.google.inject.Inject;
import com.underscoreresearch.keystore.keys.Signer;

/**
 * Routes identity linking requests to the {@link ProofService} registered for the identifier's service.
 */
@Slf4j
public class IdentityLinker {
    private final Map<Service, ProofService> services = new EnumMap<>(Service.class);

    @Inject
    public IdentityLinker(Set<ProofService> proofServices) {
        for (ProofService proofService : proofServices) {
            if (services.put(proofService.getService(), proofService) != null) {
                throw new IllegalArgumentException("Multiple proof services registered for "
                        + proofService.getService().getName());
            }
        }
    }

    public boolean supports(Service service) {
        return services.containsKey(service);
    }

    public String verify(ServiceIdentifier identifier, String signature) throws IOException {
        String accountId = serviceFor(identifier).verify(identifier.getUsername(), signature);
        log.info("Verified proof of {} for {}", identifier, accountId);
        return accountId;
    }

    public List<String> resolve(ServiceIdentifier identifier) throws IOException {
        return serviceFor(identifier).resolve(identifier.getUsername());
    }

    public String proof(ServiceIdentifier identifier, String accountId, String object, String signature) {
        return serviceFor(identifier).proof(identifier.getUsername(), accountId, object, signature);
    }

    /**
     * Signs <code>object</code> with the device key and formats the proof for publishing.
     */
    public String prove(ServiceIdentifier identifier, Signer signer, String object) {
        byte[] signature = signer.sign(object.getBytes(StandardCharsets.UTF_8));
        return proof(identifier, signer.getAccountId().toString(), object, encodeHex(signature));
    }

    private ProofService serviceFor(ServiceIdentifier identifier) {
        ProofService service = services.get(identifier.getService());
        if (service == null) {
            throw new IllegalStateException("No proof service available for " + identifier.getService().getName());
        }
        return service;
    }
}
