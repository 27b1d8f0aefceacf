package club.ppmc.meshbridge.controller;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import club.ppmc.meshbridge.config.BridgeProperties;
import club.ppmc.meshbridge.exception.MalformedCommandException;
import club.ppmc.meshbridge.exception.SessionUnavailableException;
import club.ppmc.meshbridge.model.CommandResult;
import club.ppmc.meshbridge.model.FailureReason;
import club.ppmc.meshbridge.model.HealthStatus;
import club.ppmc.meshbridge.model.SessionState;
import club.ppmc.meshbridge.service.JsonlEventLogSink;
import club.ppmc.meshbridge.session.SessionSupervisor;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
class BridgeControllerTest {

    @Mock
    private SessionSupervisor supervisor;

    @Mock
    private JsonlEventLogSink eventLog;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        var properties = new BridgeProperties();
        properties.setDefaultTimeoutSeconds(10);
        properties.setRecvTimeoutSeconds(60);
        mockMvc = MockMvcBuilders.standaloneSetup(new BridgeController(supervisor, eventLog, properties)).build();
    }

    @Test
    @DisplayName("Should return the command result with the default timeout")
    void executeCli_Success() throws Exception {
        when(supervisor.execute(List.of("infos"), Duration.ofSeconds(10)))
                .thenReturn(CommandResult.success("{\"name\": \"node\"}"));

        mockMvc.perform(post("/cli").contentType(MediaType.APPLICATION_JSON).content("{\"args\": [\"infos\"]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.stdout").value("{\"name\": \"node\"}"))
                .andExpect(jsonPath("$.returncode").value(0))
                .andExpect(jsonPath("$.reason").doesNotExist());
    }

    @Test
    @DisplayName("Should give recv the long default timeout and honor an explicit timeout")
    void executeCli_TimeoutResolution() throws Exception {
        when(supervisor.execute(anyList(), any(Duration.class))).thenReturn(CommandResult.success(""));

        mockMvc.perform(post("/cli").contentType(MediaType.APPLICATION_JSON).content("{\"args\": [\"recv\"]}"))
                .andExpect(status().isOk());
        mockMvc.perform(post("/cli").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"args\": [\"contacts\"], \"timeout\": 3}"))
                .andExpect(status().isOk());

        verify(supervisor).execute(List.of("recv"), Duration.ofSeconds(60));
        verify(supervisor).execute(List.of("contacts"), Duration.ofSeconds(3));
    }

    @Test
    @DisplayName("Should report command-level failures with 200 and success=false")
    void executeCli_Timeout_IsOkWithFailure() throws Exception {
        when(supervisor.execute(anyList(), any(Duration.class)))
                .thenReturn(CommandResult.failure(FailureReason.TIMEOUT, "Command timeout after 10 seconds"));

        mockMvc.perform(post("/cli").contentType(MediaType.APPLICATION_JSON).content("{\"args\": [\"infos\"]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.stderr").value("Command timeout after 10 seconds"))
                .andExpect(jsonPath("$.returncode").value(-1))
                .andExpect(jsonPath("$.reason").value("TIMEOUT"));
    }

    @Test
    @DisplayName("Should reject a request without args")
    void executeCli_MissingArgs_BadRequest() throws Exception {
        mockMvc.perform(post("/cli").contentType(MediaType.APPLICATION_JSON).content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.stderr").value("Missing required field: args"));
        mockMvc.perform(post("/cli").contentType(MediaType.APPLICATION_JSON).content("not json"))
                .andExpect(status().isBadRequest());

        verify(supervisor, never()).execute(anyList(), any(Duration.class));
    }

    @Test
    @DisplayName("Should reject a command that cannot be encoded as one line")
    void executeCli_Malformed_BadRequest() throws Exception {
        when(supervisor.execute(anyList(), any(Duration.class)))
                .thenThrow(new MalformedCommandException("Argument 1 contains a line terminator", 1));

        mockMvc.perform(post("/cli").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"args\": [\"msg\", \"a\\nb\"]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.stderr").value("Argument 1 contains a line terminator"));
    }

    @Test
    @DisplayName("Should answer 503 while the bridge is shutting down")
    void executeCli_Shutdown_ServiceUnavailable() throws Exception {
        when(supervisor.execute(anyList(), any(Duration.class)))
                .thenThrow(new SessionUnavailableException("meshcli bridge is shutting down"));

        mockMvc.perform(post("/cli").contentType(MediaType.APPLICATION_JSON).content("{\"args\": [\"infos\"]}"))
                .andExpect(status().isServiceUnavailable());
    }

    @Test
    @DisplayName("Should expose the session health")
    void health_ReturnsStatus() throws Exception {
        when(supervisor.health()).thenReturn(new HealthStatus(
                "healthy", SessionState.RUNNING, "/dev/ttyUSB0", "meshtastic",
                "/config/meshtastic.adverts.jsonl", 4242L, 2, 1, 0));

        mockMvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("healthy"))
                .andExpect(jsonPath("$.state").value("RUNNING"))
                .andExpect(jsonPath("$.serial_port").value("/dev/ttyUSB0"))
                .andExpect(jsonPath("$.pid").value(4242))
                .andExpect(jsonPath("$.restarts").value(1));
    }

    @Test
    @DisplayName("Should return recent events and validate the limit")
    void recentEvents_LimitHandling() throws Exception {
        var mapper = new ObjectMapper();
        when(eventLog.readRecent(eq(2))).thenReturn(List.of(mapper.readTree("{\"n\":1}"), mapper.readTree("{\"n\":2}")));

        mockMvc.perform(get("/events").param("limit", "2"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(2))
                .andExpect(jsonPath("$.events[1].n").value(2));
        mockMvc.perform(get("/events").param("limit", "0"))
                .andExpect(status().isBadRequest());
        mockMvc.perform(get("/events").param("limit", "1001"))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("Should answer 500 when the event log cannot be read")
    void recentEvents_ReadFailure_InternalError() throws Exception {
        when(eventLog.readRecent(anyInt())).thenThrow(new IOException("disk gone"));

        mockMvc.perform(get("/events"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.message").value("Failed to read event log: disk gone"));
    }
}
