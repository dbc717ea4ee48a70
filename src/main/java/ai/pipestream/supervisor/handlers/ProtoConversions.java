package ai.pipestream.supervisor.handlers;

import ai.pipestream.platform.supervisor.LogEntry;
import ai.pipestream.platform.supervisor.LogLevel;
import ai.pipestream.platform.supervisor.ServiceCommand;
import ai.pipestream.platform.supervisor.ServiceInfo;
import ai.pipestream.platform.supervisor.ServiceMetrics;
import ai.pipestream.platform.supervisor.ServiceStatus;
import ai.pipestream.supervisor.entity.HealthStatus;
import ai.pipestream.supervisor.entity.PendingCommand;
import ai.pipestream.supervisor.entity.ServiceLogEntry;
import ai.pipestream.supervisor.entity.ServiceMetricsSnapshot;
import ai.pipestream.supervisor.entity.ServiceState;
import ai.pipestream.supervisor.entity.ServiceStatusSnapshot;
import ai.pipestream.supervisor.health.HealthUpdate;
import com.google.protobuf.Duration;
import com.google.protobuf.Timestamp;

import java.time.Instant;

/**
 * Mapping between the domain model and the generated protobuf messages.
 */
public final class ProtoConversions {

    private ProtoConversions() {
    }

    public static Timestamp toTimestamp(Instant instant) {
        return Timestamp.newBuilder()
            .setSeconds(instant.getEpochSecond())
            .setNanos(instant.getNano())
            .build();
    }

    public static Instant toInstant(Timestamp timestamp) {
        return Instant.ofEpochSecond(timestamp.getSeconds(), timestamp.getNanos());
    }

    public static java.time.Duration toDuration(Duration duration) {
        return java.time.Duration.ofSeconds(duration.getSeconds(), duration.getNanos());
    }

    public static ai.pipestream.platform.supervisor.HealthStatus toProto(HealthStatus status) {
        if (status == null) {
            return ai.pipestream.platform.supervisor.HealthStatus.HEALTH_STATUS_UNSPECIFIED;
        }
        switch (status) {
            case STARTING:
                return ai.pipestream.platform.supervisor.HealthStatus.HEALTH_STATUS_STARTING;
            case HEALTHY:
                return ai.pipestream.platform.supervisor.HealthStatus.HEALTH_STATUS_HEALTHY;
            case DEGRADED:
                return ai.pipestream.platform.supervisor.HealthStatus.HEALTH_STATUS_DEGRADED;
            case UNHEALTHY:
                return ai.pipestream.platform.supervisor.HealthStatus.HEALTH_STATUS_UNHEALTHY;
            case STOPPED:
                return ai.pipestream.platform.supervisor.HealthStatus.HEALTH_STATUS_STOPPED;
            default:
                return ai.pipestream.platform.supervisor.HealthStatus.HEALTH_STATUS_UNSPECIFIED;
        }
    }

    /**
     * @return null for UNSPECIFIED and unrecognized values
     */
    public static HealthStatus fromProto(ai.pipestream.platform.supervisor.HealthStatus status) {
        switch (status) {
            case HEALTH_STATUS_STARTING:
                return HealthStatus.STARTING;
            case HEALTH_STATUS_HEALTHY:
                return HealthStatus.HEALTHY;
            case HEALTH_STATUS_DEGRADED:
                return HealthStatus.DEGRADED;
            case HEALTH_STATUS_UNHEALTHY:
                return HealthStatus.UNHEALTHY;
            case HEALTH_STATUS_STOPPED:
                return HealthStatus.STOPPED;
            default:
                return null;
        }
    }

    public static ai.pipestream.platform.supervisor.ServiceState toProto(ServiceState state) {
        switch (state) {
            case STARTING:
                return ai.pipestream.platform.supervisor.ServiceState.SERVICE_STATE_STARTING;
            case RUNNING:
                return ai.pipestream.platform.supervisor.ServiceState.SERVICE_STATE_RUNNING;
            case STOPPING:
                return ai.pipestream.platform.supervisor.ServiceState.SERVICE_STATE_STOPPING;
            case STOPPED:
                return ai.pipestream.platform.supervisor.ServiceState.SERVICE_STATE_STOPPED;
            default:
                return ai.pipestream.platform.supervisor.ServiceState.SERVICE_STATE_UNSPECIFIED;
        }
    }

    /**
     * @return null for UNSPECIFIED, meaning no filter
     */
    public static ServiceState fromProto(ai.pipestream.platform.supervisor.ServiceState state) {
        switch (state) {
            case SERVICE_STATE_STARTING:
                return ServiceState.STARTING;
            case SERVICE_STATE_RUNNING:
                return ServiceState.RUNNING;
            case SERVICE_STATE_STOPPING:
                return ServiceState.STOPPING;
            case SERVICE_STATE_STOPPED:
                return ServiceState.STOPPED;
            default:
                return null;
        }
    }

    public static ServiceMetricsSnapshot fromProto(ServiceMetrics metrics) {
        return new ServiceMetricsSnapshot(
            metrics.getCpuUsagePercent(),
            metrics.getMemoryUsageBytes(),
            metrics.getRequestsProcessed(),
            metrics.getErrorsCount(),
            metrics.getCustomMap());
    }

    public static ServiceMetrics toProto(ServiceMetricsSnapshot metrics) {
        return ServiceMetrics.newBuilder()
            .setCpuUsagePercent(metrics.cpuUsagePercent())
            .setMemoryUsageBytes(metrics.memoryUsageBytes())
            .setRequestsProcessed(metrics.requestsProcessed())
            .setErrorsCount(metrics.errorsCount())
            .putAllCustom(metrics.custom())
            .build();
    }

    public static ServiceStatus toProto(ServiceStatusSnapshot snapshot) {
        ServiceStatus.Builder builder = ServiceStatus.newBuilder()
            .setServiceId(snapshot.serviceId())
            .setInfo(ServiceInfo.newBuilder()
                .setName(snapshot.serviceName())
                .setInstanceId(nullToEmpty(snapshot.instanceId()))
                .setVersion(nullToEmpty(snapshot.version()))
                .setHost(nullToEmpty(snapshot.host()))
                .setPort(snapshot.port())
                .build())
            .setState(toProto(snapshot.state()))
            .setHealth(toProto(snapshot.health()))
            .addAllCapabilities(snapshot.capabilities())
            .setRegisteredAt(toTimestamp(snapshot.registeredAt()))
            .setLastHeartbeat(toTimestamp(snapshot.lastUpdate()))
            .setMetrics(toProto(snapshot.metrics()));
        if (snapshot.lastHealthy() != null) {
            builder.setLastHealthy(toTimestamp(snapshot.lastHealthy()));
        }
        return builder.build();
    }

    public static ai.pipestream.platform.supervisor.HealthUpdate toProto(HealthUpdate update) {
        return ai.pipestream.platform.supervisor.HealthUpdate.newBuilder()
            .setServiceId(update.serviceId())
            .setServiceName(update.serviceName())
            .setOldStatus(toProto(update.oldStatus()))
            .setNewStatus(toProto(update.newStatus()))
            .setTimestamp(toTimestamp(update.timestamp()))
            .build();
    }

    public static ServiceCommand toProto(PendingCommand command) {
        return ServiceCommand.newBuilder()
            .setCommandId(command.commandId())
            .setCommand(command.command())
            .putAllParameters(command.parameters())
            .setIssuedAt(toTimestamp(command.issuedAt()))
            .build();
    }

    /**
     * @param receivedAt Used when the worker did not stamp the entry
     */
    public static ServiceLogEntry fromProto(LogEntry entry, Instant receivedAt) {
        Instant timestamp = entry.hasTimestamp() ? toInstant(entry.getTimestamp()) : receivedAt;
        String level = entry.getLevel() == LogLevel.LOG_LEVEL_UNSPECIFIED || entry.getLevel() == LogLevel.UNRECOGNIZED
            ? "INFO"
            : entry.getLevel().name().substring("LOG_LEVEL_".length());
        return new ServiceLogEntry(entry.getServiceId(), timestamp, level, entry.getMessage(), entry.getFieldsMap());
    }

    public static LogEntry toProto(ServiceLogEntry entry) {
        return LogEntry.newBuilder()
            .setServiceId(entry.serviceId())
            .setTimestamp(toTimestamp(entry.timestamp()))
            .setLevel(toLogLevel(entry.level()))
            .setMessage(entry.message())
            .putAllFields(entry.fields())
            .build();
    }

    private static LogLevel toLogLevel(String level) {
        try {
            return LogLevel.valueOf("LOG_LEVEL_" + level);
        } catch (IllegalArgumentException e) {
            return LogLevel.LOG_LEVEL_INFO;
        }
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
