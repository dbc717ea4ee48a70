package ai.pipestream.supervisor.process;

import ai.pipestream.supervisor.entity.ServiceDescriptor;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Owns exactly one {@link ServiceProcess} per configured service.
 */
public class ProcessController {

    private static final Logger LOG = Logger.getLogger(ProcessController.class);

    private final Map<String, ServiceProcess> processes;

    public ProcessController(List<ServiceDescriptor> descriptors, PortOffsetRewriter portOffset,
                             ProcessEnvironment environment) {
        Map<String, ServiceProcess> byName = new LinkedHashMap<>();
        descriptors.stream()
            .sorted(Comparator.comparing(ServiceDescriptor::name))
            .forEach(d -> byName.put(d.name(), new ServiceProcess(d, portOffset, environment)));
        this.processes = Collections.unmodifiableMap(byName);
    }

    public List<ServiceDescriptor> descriptors() {
        return processes.values().stream()
            .map(ServiceProcess::descriptor)
            .collect(Collectors.toList());
    }

    public Optional<ServiceDescriptor> descriptor(String name) {
        return Optional.ofNullable(processes.get(name)).map(ServiceProcess::descriptor);
    }

    /**
     * Launch a configured service
     * @throws ProcessStartException if unknown, disabled, already running or the launch failed
     */
    public void start(String name) {
        ServiceProcess process = processes.get(name);
        if (process == null) {
            throw new ProcessStartException("Service " + name + " is not configured");
        }
        if (!process.descriptor().enabled()) {
            throw new ProcessStartException("Service " + name + " is disabled");
        }
        process.start();
    }

    /**
     * Stop a configured service, see {@link ServiceProcess#stop(boolean, Duration)}
     */
    public Uni<Void> stop(String name, boolean force, Duration gracePeriod) {
        ServiceProcess process = processes.get(name);
        if (process == null) {
            return Uni.createFrom().failure(new IllegalArgumentException("Service " + name + " is not configured"));
        }
        return process.stop(force, gracePeriod);
    }

    public boolean isRunning(String name) {
        ServiceProcess process = processes.get(name);
        return process != null && process.isRunning();
    }

    /**
     * Stop every running process concurrently. Individual failures are logged, not propagated.
     */
    public Uni<Void> stopAll(Duration gracePeriod) {
        List<Uni<Void>> stops = processes.values().stream()
            .filter(ServiceProcess::isRunning)
            .map(process -> process.stop(false, gracePeriod)
                .onFailure().recoverWithItem(error -> {
                    LOG.errorf("Failed to stop %s: %s", process.descriptor().name(), error.getMessage());
                    return null;
                }))
            .collect(Collectors.toList());

        if (stops.isEmpty()) {
            return Uni.createFrom().voidItem();
        }
        LOG.infof("Stopping %d running services", stops.size());
        return Uni.join().all(stops).andCollectFailures().replaceWithVoid();
    }

    /**
     * Enabled services ordered so that every service comes after its dependencies.
     * Cycles and unknown dependencies are logged and skipped.
     */
    public List<String> startupOrder() {
        List<String> order = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        Set<String> visiting = new HashSet<>();
        for (ServiceProcess process : processes.values()) {
            if (process.descriptor().enabled()) {
                visit(process.descriptor().name(), visited, visiting, order);
            }
        }
        return order;
    }

    private void visit(String name, Set<String> visited, Set<String> visiting, List<String> order) {
        if (visited.contains(name)) {
            return;
        }
        if (!visiting.add(name)) {
            LOG.warnf("Circular dependency detected involving service '%s'", name);
            return;
        }

        ServiceProcess process = processes.get(name);
        if (process == null) {
            LOG.warnf("Dependency '%s' is not a configured service", name);
        } else if (process.descriptor().enabled()) {
            for (String dependency : process.descriptor().dependencies()) {
                visit(dependency, visited, visiting, order);
            }
        }

        visiting.remove(name);
        visited.add(name);
        if (process != null && process.descriptor().enabled()) {
            order.add(name);
        }
    }
}
