package com.libragraph.modelgate.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.libragraph.modelgate.core.permission.RoutePermission;
import com.libragraph.modelgate.core.permission.RoutePermissionSource;
import com.libragraph.modelgate.core.provider.ModelProvider;
import com.libragraph.modelgate.core.provider.ProviderRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;

import java.util.Comparator;
import java.util.List;

@Path("/providers")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
public class ProviderResource implements RoutePermissionSource {

    @Inject
    ProviderRegistry providers;

    public record ProviderInfo(@JsonProperty("name") String name, @JsonProperty("models") List<String> models) {}

    @Override
    public List<RoutePermission> routePermissions() {
        return List.of(RoutePermission.of("GET", "/providers", "provider", "read"));
    }

    @GET
    public ApiResponse list() {
        List<ProviderInfo> infos = providers.all().stream()
                .sorted(Comparator.comparing(ModelProvider::name))
                .map(p -> new ProviderInfo(p.name(), p.supportedModels().stream().sorted().toList()))
                .toList();
        return ApiResponse.ok("Providers retrieved", infos);
    }
}
