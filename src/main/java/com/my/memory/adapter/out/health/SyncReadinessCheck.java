package com.my.memory.adapter.out.health;

import com.my.memory.domain.model.ProjectSyncStatus;
import com.my.memory.domain.model.SyncState;
import com.my.memory.domain.port.in.SyncControlUseCase;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.HealthCheckResponseBuilder;
import org.eclipse.microprofile.health.Readiness;

import java.util.List;

@Readiness
@ApplicationScoped
public class SyncReadinessCheck implements HealthCheck {

    private final SyncControlUseCase syncControl;

    public SyncReadinessCheck(SyncControlUseCase syncControl) {
        this.syncControl = syncControl;
    }

    @Override
    public HealthCheckResponse call() {
        List<ProjectSyncStatus> statuses = syncControl.syncStatuses();
        boolean healthy = true;
        HealthCheckResponseBuilder builder = HealthCheckResponse.named("sync-readiness")
                .withData("projects", statuses.size());
        for (ProjectSyncStatus status : statuses) {
            builder.withData(status.project(), status.state().name());
            if (status.state() == SyncState.ERROR) {
                healthy = false;
                builder.withData(status.project() + ".lastError", String.valueOf(status.lastError()));
            }
        }
        return builder.status(healthy).build();
    }
}
