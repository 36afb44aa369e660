package com.libragraph.modelgate.api;

import com.libragraph.modelgate.core.error.ValidationException;
import com.libragraph.modelgate.core.permission.RoutePermission;
import com.libragraph.modelgate.core.permission.RoutePermissionSource;
import com.libragraph.modelgate.core.task.CreateTaskCommand;
import com.libragraph.modelgate.core.task.TaskFilter;
import com.libragraph.modelgate.core.task.TaskOrchestrator;
import com.libragraph.modelgate.core.task.TaskResult;
import com.libragraph.modelgate.core.task.TaskStatus;
import com.libragraph.modelgate.core.task.TaskView;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import java.util.List;

@Path("/tasks")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
public class TaskResource implements RoutePermissionSource {

    @Inject
    TaskOrchestrator orchestrator;

    @Inject
    CallerContext callerContext;

    @Override
    public List<RoutePermission> routePermissions() {
        return List.of(
                RoutePermission.of("POST", "/tasks", "task", "create"),
                RoutePermission.of("GET", "/tasks", "task", "list"),
                RoutePermission.of("GET", "/tasks/{id}/status", "task", "read"),
                RoutePermission.of("GET", "/tasks/{id}/result", "task", "read"),
                RoutePermission.of("POST", "/tasks/{id}/cancel", "task", "cancel"));
    }

    @POST
    @Consumes(MediaType.APPLICATION_JSON)
    public Response create(CreateTaskCommand command) {
        TaskView task = orchestrator.create(command, callerContext.caller());
        if (task.async()) {
            return Response.status(Response.Status.CREATED)
                    .entity(ApiResponse.ok("Task created", task))
                    .build();
        }
        return Response.ok(ApiResponse.ok("Task " + task.status().label(), task)).build();
    }

    @GET
    @Path("/{id}/status")
    public ApiResponse status(@PathParam("id") String id) {
        return ApiResponse.ok("Task status retrieved", orchestrator.status(id, callerContext.caller()));
    }

    @GET
    @Path("/{id}/result")
    public ApiResponse result(@PathParam("id") String id) {
        TaskResult result = orchestrator.result(id, callerContext.caller());
        return ApiResponse.ok(result.describe(), result);
    }

    @POST
    @Path("/{id}/cancel")
    public ApiResponse cancel(@PathParam("id") String id) {
        return ApiResponse.ok("Task cancelled", orchestrator.cancel(id, callerContext.caller()));
    }

    @GET
    public ApiResponse list(@QueryParam("status") String status,
                            @QueryParam("model") String model,
                            @QueryParam("provider") String provider,
                            @QueryParam("page") String page,
                            @QueryParam("page_size") String pageSize) {
        TaskStatus statusFilter = null;
        if (status != null && !status.isBlank()) {
            statusFilter = TaskStatus.fromLabel(status)
                    .orElseThrow(() -> new ValidationException("Invalid status filter: " + status));
        }
        TaskFilter filter = new TaskFilter(null, statusFilter, blankToNull(model), blankToNull(provider));
        return ApiResponse.ok("Tasks retrieved", orchestrator.list(filter,
                intParam("page", page, 1),
                intParam("page_size", pageSize, TaskOrchestrator.DEFAULT_PAGE_SIZE),
                callerContext.caller()));
    }

    private static int intParam(String name, String value, int defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new ValidationException(name + " must be an integer: " + value);
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
