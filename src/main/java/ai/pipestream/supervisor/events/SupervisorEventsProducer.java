package ai.pipestream.supervisor.events;

import ai.pipestream.platform.supervisor.events.ServiceHealthChanged;
import ai.pipestream.platform.supervisor.events.ServiceRegistered;
import ai.pipestream.platform.supervisor.events.ServiceUnregistered;
import ai.pipestream.platform.supervisor.events.SystemReady;
import ai.pipestream.supervisor.entity.ServiceStatusSnapshot;
import ai.pipestream.supervisor.handlers.ProtoConversions;
import ai.pipestream.supervisor.health.HealthTransitionListener;
import ai.pipestream.supervisor.health.HealthUpdate;
import ai.pipestream.supervisor.registry.WorkerIdentity;
import io.smallrye.reactive.messaging.MutinyEmitter;
import io.smallrye.reactive.messaging.kafka.api.OutgoingKafkaRecordMetadata;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.reactive.messaging.Channel;
import org.eclipse.microprofile.reactive.messaging.Message;
import org.jboss.logging.Logger;

import java.time.Instant;
import java.util.UUID;

/**
 * Publishes supervisor lifecycle events to Kafka.
 * Publication is best effort: a failed emit is logged and never reaches the caller.
 * Key: UUID
 * Value: Protobuf events
 */
@ApplicationScoped
public class SupervisorEventsProducer implements HealthTransitionListener {

    private static final Logger LOG = Logger.getLogger(SupervisorEventsProducer.class);

    @Channel("supervisor-service-registered-events")
    MutinyEmitter<ServiceRegistered> serviceRegisteredEmitter;

    @Channel("supervisor-service-unregistered-events")
    MutinyEmitter<ServiceUnregistered> serviceUnregisteredEmitter;

    @Channel("supervisor-health-events")
    MutinyEmitter<ServiceHealthChanged> healthChangedEmitter;

    @Channel("supervisor-system-ready-events")
    MutinyEmitter<SystemReady> systemReadyEmitter;

    /**
     * Emit a service registered event
     * @param serviceId The generated service ID
     * @param identity What the worker reported about itself
     */
    public void emitServiceRegistered(String serviceId, WorkerIdentity identity) {
        try {
            ServiceRegistered event = ServiceRegistered.newBuilder()
                .setServiceId(serviceId)
                .setServiceName(identity.name())
                .setInstanceId(identity.instanceId())
                .setHost(identity.host())
                .setPort(identity.port())
                .setVersion(identity.version())
                .setTimestamp(ProtoConversions.toTimestamp(Instant.now()))
                .build();

            UUID key = send(serviceRegisteredEmitter, event);
            LOG.debugf("Emitted ServiceRegistered event: serviceId=%s, key=%s", serviceId, key);
        } catch (Exception e) {
            LOG.warnf(e, "Failed to emit ServiceRegistered event: %s", serviceId);
        }
    }

    /**
     * Emit a service unregistered event
     * @param removed Final state of the removed registration
     * @param reason Reason given by the caller, may be empty
     */
    public void emitServiceUnregistered(ServiceStatusSnapshot removed, String reason) {
        try {
            ServiceUnregistered event = ServiceUnregistered.newBuilder()
                .setServiceId(removed.serviceId())
                .setServiceName(removed.serviceName())
                .setReason(reason == null ? "" : reason)
                .setTimestamp(ProtoConversions.toTimestamp(Instant.now()))
                .build();

            UUID key = send(serviceUnregisteredEmitter, event);
            LOG.debugf("Emitted ServiceUnregistered event: serviceId=%s, key=%s", removed.serviceId(), key);
        } catch (Exception e) {
            LOG.warnf(e, "Failed to emit ServiceUnregistered event: %s", removed.serviceId());
        }
    }

    /**
     * Health transitions arrive here from the health monitor. Emitting never blocks.
     */
    @Override
    public void onHealthChanged(HealthUpdate update) {
        emitHealthChanged(update);
    }

    public void emitHealthChanged(HealthUpdate update) {
        try {
            ServiceHealthChanged event = ServiceHealthChanged.newBuilder()
                .setServiceId(update.serviceId())
                .setServiceName(update.serviceName())
                .setOldStatus(ProtoConversions.toProto(update.oldStatus()))
                .setNewStatus(ProtoConversions.toProto(update.newStatus()))
                .setTimestamp(ProtoConversions.toTimestamp(update.timestamp()))
                .build();

            UUID key = send(healthChangedEmitter, event);
            LOG.debugf("Emitted ServiceHealthChanged event: serviceId=%s, %s -> %s, key=%s",
                update.serviceId(), update.oldStatus(), update.newStatus(), key);
        } catch (Exception e) {
            LOG.warnf(e, "Failed to emit ServiceHealthChanged event: %s", update.serviceId());
        }
    }

    /**
     * Emit the one-off system ready event
     * @param instanceGroupId Instance group this supervisor runs
     * @param readyAt When the readiness latch flipped
     */
    public void emitSystemReady(String instanceGroupId, Instant readyAt) {
        try {
            SystemReady event = SystemReady.newBuilder()
                .setInstanceGroupId(instanceGroupId)
                .setReadyAt(ProtoConversions.toTimestamp(readyAt))
                .build();

            UUID key = send(systemReadyEmitter, event);
            LOG.debugf("Emitted SystemReady event: group=%s, key=%s", instanceGroupId, key);
        } catch (Exception e) {
            LOG.warnf(e, "Failed to emit SystemReady event for group %s", instanceGroupId);
        }
    }

    private static <T> UUID send(MutinyEmitter<T> emitter, T event) {
        UUID key = UUID.randomUUID();
        OutgoingKafkaRecordMetadata<UUID> metadata = OutgoingKafkaRecordMetadata.<UUID>builder()
            .withKey(key)
            .build();
        emitter.sendMessageAndForget(Message.of(event).addMetadata(metadata));
        return key;
    }
}
