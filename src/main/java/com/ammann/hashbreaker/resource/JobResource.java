/* (C)2026 */
package com.ammann.hashbreaker.resource;

import com.ammann.hashbreaker.dto.JobCancelResponseDTO;
import com.ammann.hashbreaker.dto.JobStatusDTO;
import com.ammann.hashbreaker.dto.JobSubmissionRequestDTO;
import com.ammann.hashbreaker.dto.JobSubmissionResponseDTO;
import com.ammann.hashbreaker.exception.GlobalExceptionHandler;
import com.ammann.hashbreaker.properties.ApiProperties;
import com.ammann.hashbreaker.service.CrackJobService;
import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;

/**
 * REST resource for submitting hash audit jobs, polling their status and cancelling them.
 */
@Path(ApiProperties.BASE_URL_V1 + ApiProperties.Jobs.BASE)
@Tag(name = "Jobs API", description = "Hash audit job submission, status and cancellation")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class JobResource {

    private static final Logger LOG = Logger.getLogger(JobResource.class);

    @Inject CrackJobService jobService;

    @POST
    @Operation(
            summary = "Submit Hash Audit Job",
            description = "Queues a hash for the multi-phase cracking pipeline")
    @APIResponses({
        @APIResponse(
                responseCode = "202",
                description = "Job accepted",
                content = @Content(schema = @Schema(implementation = JobSubmissionResponseDTO.class))),
        @APIResponse(
                responseCode = "400",
                description = "Invalid parameters",
                content = @Content(schema = @Schema(implementation = GlobalExceptionHandler.ErrorResponse.class))),
        @APIResponse(responseCode = "503", description = "Job store unavailable")
    })
    public Response submit(JobSubmissionRequestDTO request) {
        LOG.debugf("Submit request: hashTypeId=%s, timeout=%s, priority=%s",
                request != null ? request.hashTypeId() : null,
                request != null ? request.timeoutSeconds() : null,
                request != null ? request.priority() : null);
        JobSubmissionResponseDTO response = jobService.submit(request);
        return Response.status(Response.Status.ACCEPTED).entity(response).build();
    }

    @GET
    @Path(ApiProperties.Jobs.BY_ID)
    @Operation(
            summary = "Get Job Status",
            description = "Returns the job record; elapsed and remaining time are live while RUNNING")
    @APIResponses({
        @APIResponse(
                responseCode = "200",
                description = "Job found",
                content = @Content(schema = @Schema(implementation = JobStatusDTO.class))),
        @APIResponse(responseCode = "404", description = "Unknown or expired job")
    })
    public JobStatusDTO status(@PathParam("jobId") String jobId) {
        return jobService.getStatus(jobId);
    }

    @POST
    @Path(ApiProperties.Jobs.CANCEL)
    @Operation(
            summary = "Cancel Job",
            description = "Cancels a pending or running job; running jobs stop at the next phase boundary")
    @APIResponses({
        @APIResponse(
                responseCode = "200",
                description = "Cancellation recorded",
                content = @Content(schema = @Schema(implementation = JobCancelResponseDTO.class))),
        @APIResponse(responseCode = "404", description = "Unknown or expired job"),
        @APIResponse(responseCode = "409", description = "Job already finished")
    })
    public JobCancelResponseDTO cancel(@PathParam("jobId") String jobId) {
        return jobService.cancel(jobId);
    }
}
