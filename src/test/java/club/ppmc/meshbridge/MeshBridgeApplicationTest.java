package club.ppmc.meshbridge;

import static org.assertj.core.api.Assertions.assertThat;

import club.ppmc.meshbridge.model.HealthStatus;
import club.ppmc.meshbridge.model.SessionState;
import club.ppmc.meshbridge.service.JsonlEventLogSink;
import club.ppmc.meshbridge.service.WebSocketNotificationService;
import club.ppmc.meshbridge.session.ProcessLauncher;
import club.ppmc.meshbridge.session.SessionEventListener;
import club.ppmc.meshbridge.session.SessionSupervisor;
import java.io.IOException;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;

@SpringBootTest(properties = {
    "bridge.config-dir=${java.io.tmpdir}/meshbridge-context-test",
    "bridge.device-name=contextnode",
    "bridge.init-delay-millis=0",
    "bridge.health-check-interval-millis=600000"
})
class MeshBridgeApplicationTest {

    @TestConfiguration
    static class UnavailableMeshCli {

        @Bean
        @Primary
        ProcessLauncher unavailableLauncher() {
            return () -> {
                throw new IOException("meshcli: command not found");
            };
        }
    }

    @Autowired
    private SessionSupervisor supervisor;

    @Autowired
    private List<SessionEventListener> listeners;

    @Test
    @DisplayName("Should start the application and report an unhealthy session when meshcli cannot be launched")
    void contextLoads_WithUnavailableMeshCli() {
        HealthStatus health = supervisor.health();

        assertThat(health.status()).isEqualTo("unhealthy");
        assertThat(health.state()).isEqualTo(SessionState.CRASHED);
        assertThat(health.deviceName()).isEqualTo("contextnode");
        assertThat(health.advertLog()).endsWith("contextnode.adverts.jsonl");
        assertThat(health.pid()).isNull();
        assertThat(listeners).hasAtLeastOneElementOfType(JsonlEventLogSink.class)
                .hasAtLeastOneElementOfType(WebSocketNotificationService.class);
    }
}
