package io.tenantq.internal;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.UUID;

final class WorkerIds {
    private WorkerIds() {
    }

    /**
     * The configured id, or host-pid-uuid.
     */
    static String resolve(String configuredWorkerId) {
        if (configuredWorkerId != null && !configuredWorkerId.isBlank()) {
            return configuredWorkerId;
        }

        String pid = String.valueOf(ProcessHandle.current().pid());
        String generated = hostName() + "-" + pid + "-" + UUID.randomUUID();
        return generated.length() > 128 ? generated.substring(0, 128) : generated;
    }

    private static String hostName() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            return "tenantq";
        }
    }
}
