package com.libragraph.modelgate.api;

import com.libragraph.modelgate.core.db.DatabaseService;
import com.libragraph.modelgate.core.service.ManagedService;
import com.libragraph.modelgate.core.task.TaskWorkerPool;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/** Public liveness summary. */
@Path("/health")
@Produces(MediaType.APPLICATION_JSON)
public class HealthResource {

    @Inject
    DatabaseService database;

    @Inject
    TaskWorkerPool workerPool;

    /**
     * 503 only when the database cannot be reached. A reachable database with a
     * FAILED gate or worker pool reports {@code degraded} until the next
     * connectivity check recovers them.
     */
    @GET
    public Response health() {
        boolean databaseUp = database.isReachable();
        boolean executing = database.isRunning() && workerPool.isRunning();
        Map<String, Object> results = new LinkedHashMap<>();
        results.put("status", databaseUp && executing ? "ok" : "degraded");
        results.put("database", databaseUp ? "up" : "down");
        results.put("database_service", stateLabel(database));
        results.put("workers", stateLabel(workerPool));
        return Response.status(databaseUp ? Response.Status.OK : Response.Status.SERVICE_UNAVAILABLE)
                .entity(new ApiResponse(databaseUp, databaseUp ? "Service healthy" : "Database unavailable", results))
                .build();
    }

    private static String stateLabel(ManagedService service) {
        return service.state().name().toLowerCase(Locale.ROOT);
    }
}
