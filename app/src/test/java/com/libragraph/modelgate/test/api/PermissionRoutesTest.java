package com.libragraph.modelgate.test.api;

import com.libragraph.modelgate.core.permission.PermissionRegistry;
import com.libragraph.modelgate.core.permission.PermissionRequirement;
import com.libragraph.modelgate.test.VendorStubResource;
import io.quarkus.test.common.QuarkusTestResource;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@QuarkusTest
@QuarkusTestResource(VendorStubResource.class)
class PermissionRoutesTest {

    @Inject
    PermissionRegistry registry;

    @Test
    void collectsEveryDeclaredRoute() {
        assertThat(registry.size()).isEqualTo(6);
    }

    @Test
    void mapsTaskRoutes() {
        assertThat(registry.lookup("/tasks", "POST")).contains(PermissionRequirement.of("task", "create"));
        assertThat(registry.lookup("/tasks", "GET")).contains(PermissionRequirement.of("task", "list"));
        assertThat(registry.lookup("/tasks/abc/status", "GET")).contains(PermissionRequirement.of("task", "read"));
        assertThat(registry.lookup("/tasks/abc/result", "GET")).contains(PermissionRequirement.of("task", "read"));
        assertThat(registry.lookup("/tasks/abc/cancel", "POST")).contains(PermissionRequirement.of("task", "cancel"));
        assertThat(registry.lookup("/providers", "GET")).contains(PermissionRequirement.of("provider", "read"));
    }

    @Test
    void unmappedRoutesArePublic() {
        assertThat(registry.lookup("/health", "GET")).isEmpty();
        assertThat(registry.lookup("/tasks/abc/cancel", "GET")).isEmpty();
    }
}
