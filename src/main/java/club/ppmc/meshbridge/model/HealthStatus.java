/**
 * HealthStatus.java
 *
 * GET /health 的响应体。只读，没有副作用。
 */
package club.ppmc.meshbridge.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record HealthStatus(
        String status,
        SessionState state,
        @JsonProperty("serial_port") String serialPort,
        @JsonProperty("device_name") String deviceName,
        @JsonProperty("advert_log") String advertLog,
        Long pid,
        long generation,
        int restarts,
        @JsonProperty("pending_commands") int pendingCommands) {}
