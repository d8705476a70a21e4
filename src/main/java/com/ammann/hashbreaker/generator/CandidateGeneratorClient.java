/* (C)2026 */
package com.ammann.hashbreaker.generator;

import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import java.util.List;
import org.eclipse.microprofile.rest.client.inject.RegisterRestClient;

/**
 * REST client for the candidate generation model server.
 */
@Path("/generate")
@RegisterRestClient(configKey = "candidate-generator")
public interface CandidateGeneratorClient {

    @POST
    @Consumes(MediaType.APPLICATION_JSON)
    @Produces(MediaType.APPLICATION_JSON)
    GenerateResponse generate(GenerateRequest request);

    record GenerateRequest(int count) { }

    record GenerateResponse(List<String> passwords) { }
}
