package com.pocketai.catalog.resource;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.pocketai.catalog.dto.SyncResponse;
import com.pocketai.catalog.hub.CatalogUnavailableException;
import com.pocketai.catalog.service.ModelSyncService;
import com.pocketai.catalog.service.SyncRunSummary;

import jakarta.annotation.security.RolesAllowed;
import jakarta.inject.Inject;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

/**
 * On-demand trigger for the model hub sync. Runs synchronously and answers
 * with the run summary.
 */
@Path("/admin/sync")
public class AdminSyncResource {

    private static final Logger log = LoggerFactory.getLogger(AdminSyncResource.class);

    @Inject
    ModelSyncService syncService;

    @POST
    @Path("/models")
    @RolesAllowed("ADMIN")
    @Produces(MediaType.APPLICATION_JSON)
    public Response triggerSync() {
        log.info("Manual model sync requested");
        try {
            SyncRunSummary summary = syncService.runSync();
            return Response.ok(SyncResponse.success(summary).toMap()).build();
        } catch (CatalogUnavailableException e) {
            log.warn("Manual model sync failed, hub unavailable: {}", e.getMessage());
            return Response.status(Response.Status.BAD_GATEWAY)
                    .entity(SyncResponse.failure(e).toMap()).build();
        } catch (RuntimeException e) {
            log.error("Manual model sync failed", e);
            return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                    .entity(SyncResponse.failure(e).toMap()).build();
        }
    }
}
