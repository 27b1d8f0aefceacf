/**
 * BridgeController.java
 *
 * 桥接服务对 Web 应用暴露的 HTTP 接口：执行 meshcli 命令、健康检查、读取最近的异步事件。
 * 命令级别的失败 (超时、会话崩溃) 以 200 和 success=false 返回，与直接运行子进程时的语义一致；
 * 请求本身不合法时返回 400，服务已关闭时返回 503。
 */
package club.ppmc.meshbridge.controller;

import club.ppmc.meshbridge.config.BridgeProperties;
import club.ppmc.meshbridge.exception.MalformedCommandException;
import club.ppmc.meshbridge.exception.SessionUnavailableException;
import club.ppmc.meshbridge.model.CliRequest;
import club.ppmc.meshbridge.model.CommandResult;
import club.ppmc.meshbridge.model.HealthStatus;
import club.ppmc.meshbridge.service.JsonlEventLogSink;
import club.ppmc.meshbridge.session.SessionSupervisor;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.Valid;
import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.*;

@RestController
@Slf4j
public class BridgeController {

    static final int MAX_EVENT_LIMIT = 1000;

    private final SessionSupervisor supervisor;
    private final JsonlEventLogSink eventLog;
    private final BridgeProperties properties;

    public BridgeController(SessionSupervisor supervisor, JsonlEventLogSink eventLog, BridgeProperties properties) {
        this.supervisor = supervisor;
        this.eventLog = eventLog;
        this.properties = properties;
    }

    /**
     * 通过持久会话执行一条 meshcli 命令，并等待其输出静默。
     */
    @PostMapping("/cli")
    public ResponseEntity<CommandResult> executeCli(@Valid @RequestBody CliRequest request) {
        List<String> args = request.args();
        Duration timeout = resolveTimeout(args, request.timeout());
        try {
            return ResponseEntity.ok(supervisor.execute(args, timeout));
        } catch (MalformedCommandException e) {
            log.warn("拒绝无法编码的命令: {}", e.getMessage());
            return ResponseEntity.badRequest().body(CommandResult.rejected(e.getMessage()));
        } catch (SessionUnavailableException e) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(CommandResult.rejected(e.getMessage()));
        } catch (RuntimeException e) {
            log.error("执行命令 {} 时发生内部错误", args, e);
            return ResponseEntity.internalServerError().body(CommandResult.rejected(e.getMessage()));
        }
    }

    /**
     * 当前会话状态及基本信息。没有副作用。
     */
    @GetMapping("/health")
    public ResponseEntity<HealthStatus> health() {
        return ResponseEntity.ok(supervisor.health());
    }

    /**
     * 读取事件日志中最近的若干条记录 (从旧到新)。
     */
    @GetMapping("/events")
    public ResponseEntity<?> recentEvents(@RequestParam(defaultValue = "50") int limit) {
        if (limit <= 0 || limit > MAX_EVENT_LIMIT) {
            return ResponseEntity.badRequest()
                    .body(Map.of("message", "limit must be between 1 and " + MAX_EVENT_LIMIT));
        }
        try {
            List<JsonNode> events = eventLog.readRecent(limit);
            return ResponseEntity.ok(Map.of("events", events, "count", events.size()));
        } catch (IOException e) {
            log.error("读取事件日志失败", e);
            return ResponseEntity.internalServerError()
                    .body(Map.of("message", "Failed to read event log: " + e.getMessage()));
        }
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<CommandResult> handleInvalidRequest(MethodArgumentNotValidException e) {
        FieldError error = e.getBindingResult().getFieldError();
        String message = error != null
                ? (error.getField().equals("args") ? error.getDefaultMessage() : error.getField() + " " + error.getDefaultMessage())
                : "Invalid request";
        return ResponseEntity.badRequest().body(CommandResult.rejected(message));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<CommandResult> handleUnreadableRequest(HttpMessageNotReadableException e) {
        return ResponseEntity.badRequest()
                .body(CommandResult.rejected("Request body must be a JSON object with an 'args' list"));
    }

    Duration resolveTimeout(List<String> args, Integer requested) {
        if (requested != null) {
            return Duration.ofSeconds(requested);
        }
        if ("recv".equals(args.get(0))) {
            return Duration.ofSeconds(properties.getRecvTimeoutSeconds());
        }
        return Duration.ofSeconds(properties.getDefaultTimeoutSeconds());
    }
}
