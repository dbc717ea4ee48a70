package ai.pipestream.supervisor.registry;

/**
 * No registered service carries the given identifier
 */
public class ServiceNotFoundException extends RuntimeException {

    private final String serviceId;

    public ServiceNotFoundException(String serviceId) {
        super("Service not found: " + serviceId);
        this.serviceId = serviceId;
    }

    public String getServiceId() {
        return serviceId;
    }
}
