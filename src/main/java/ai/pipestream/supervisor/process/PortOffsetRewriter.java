package ai.pipestream.supervisor.process;

import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Shifts the port of internal endpoint flags by the instance port offset so several
 * instance groups can share one host.
 * <p>
 * Only {@code --flag=value} arguments whose flag is in the internal set are touched, and
 * only when the value is a bare port or a {@code host:port} pair. Anything else passes
 * through unchanged. External-facing ports are never part of the internal set.
 */
public class PortOffsetRewriter {

    private static final Logger LOG = Logger.getLogger(PortOffsetRewriter.class);

    /** Flags carrying internal endpoints: bind port, peer supervisor address, listen address */
    public static final Set<String> DEFAULT_INTERNAL_FLAGS = Set.of(
        "--port",
        "--grpc-port",
        "--supervisor",
        "--supervisor-address",
        "--grpc-address",
        "--listen-address"
    );

    private static final int MAX_PORT = 65535;

    private final int offset;
    private final Set<String> internalFlags;

    public PortOffsetRewriter(int offset) {
        this(offset, DEFAULT_INTERNAL_FLAGS);
    }

    public PortOffsetRewriter(int offset, Set<String> internalFlags) {
        this.offset = offset;
        this.internalFlags = Set.copyOf(internalFlags);
    }

    public int offset() {
        return offset;
    }

    /**
     * Rewrite an argument list
     * @param args The argument template
     * @return A new list with internal ports shifted
     */
    public List<String> rewrite(List<String> args) {
        List<String> rewritten = new ArrayList<>(args.size());
        for (String arg : args) {
            rewritten.add(rewriteArgument(arg));
        }
        return rewritten;
    }

    /**
     * Rewrite a single argument, returning it untouched when it does not qualify
     */
    public String rewriteArgument(String arg) {
        if (offset == 0 || arg == null) {
            return arg;
        }
        int eq = arg.indexOf('=');
        if (eq <= 0 || !internalFlags.contains(arg.substring(0, eq))) {
            return arg;
        }

        String flag = arg.substring(0, eq);
        String value = arg.substring(eq + 1);
        int colon = value.lastIndexOf(':');
        String hostPart = colon >= 0 ? value.substring(0, colon + 1) : "";
        String portPart = colon >= 0 ? value.substring(colon + 1) : value;

        Integer shifted = shiftPort(portPart);
        if (shifted == null) {
            LOG.debugf("Leaving argument %s unchanged: no numeric port", arg);
            return arg;
        }
        return flag + "=" + hostPart + shifted;
    }

    /**
     * Apply the offset to a numeric port
     * @return the shifted port, or the port unchanged when it would leave the valid range
     */
    public int applyOffset(int port) {
        int shifted = port + offset;
        if (shifted <= 0 || shifted > MAX_PORT) {
            LOG.warnf("Port offset %d would move port %d out of range, keeping it", offset, port);
            return port;
        }
        return shifted;
    }

    private Integer shiftPort(String portPart) {
        if (portPart.isEmpty() || !portPart.chars().allMatch(Character::isDigit)) {
            return null;
        }
        int port;
        try {
            port = Integer.parseInt(portPart);
        } catch (NumberFormatException e) {
            return null;
        }
        int shifted = port + offset;
        if (shifted <= 0 || shifted > MAX_PORT) {
            LOG.warnf("Port offset %d would move port %d out of range, keeping it", offset, port);
            return null;
        }
        return shifted;
    }
}
