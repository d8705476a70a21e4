/* (C)2026 */
package com.ammann.hashbreaker.generator;

import com.ammann.hashbreaker.config.HashBreakerSettings;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.ProcessingException;
import jakarta.ws.rs.WebApplicationException;
import java.util.List;
import org.eclipse.microprofile.rest.client.inject.RestClient;
import org.jboss.logging.Logger;

/**
 * Candidate generator backed by the remote model server.
 * <p>
 * A disabled generator or a failed call yields an empty batch, which the AI-generation phase
 * treats as exhaustion.
 */
@ApplicationScoped
public class RemoteCandidateGenerator implements CandidateGenerator {

    private static final Logger LOG = Logger.getLogger(RemoteCandidateGenerator.class);

    private final CandidateGeneratorClient client;
    private final HashBreakerSettings settings;

    @Inject
    public RemoteCandidateGenerator(@RestClient CandidateGeneratorClient client, HashBreakerSettings settings) {
        this.client = client;
        this.settings = settings;
    }

    @Override
    public List<String> generate(int count) {
        if (!settings.generatorEnabled() || count <= 0) {
            return List.of();
        }
        try {
            CandidateGeneratorClient.GenerateResponse response =
                    client.generate(new CandidateGeneratorClient.GenerateRequest(count));
            if (response == null || response.passwords() == null) {
                return List.of();
            }
            return response.passwords();
        } catch (WebApplicationException | ProcessingException e) {
            LOG.warnf("Candidate generator call for %d candidates failed, treating as exhausted: %s",
                    count, e.getMessage());
            return List.of();
        }
    }
}
