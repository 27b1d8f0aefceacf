/**
 * JsonlEventLogSink.java
 *
 * 将 meshcli 的异步事件追加到 <配置目录>/<设备名>.adverts.jsonl，每行一个 JSON 对象。
 * 写入时注入 "ts" 字段 (接收时刻的 Unix 秒，带小数)，覆盖 payload 中同名字段。
 * 写入是尽力而为的：失败只记录日志，绝不影响命令执行。
 * 同时提供读取最近若干条事件的能力，供 GET /events 使用。
 */
package club.ppmc.meshbridge.service;

import club.ppmc.meshbridge.config.BridgeProperties;
import club.ppmc.meshbridge.model.EventRecord;
import club.ppmc.meshbridge.session.SessionEventListener;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.input.ReversedLinesFileReader;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

@Service
@Slf4j
public class JsonlEventLogSink implements SessionEventListener {

    static final String TIMESTAMP_FIELD = "ts";

    private final Path logPath;
    private final ObjectMapper objectMapper = new ObjectMapper();

    @Autowired
    public JsonlEventLogSink(BridgeProperties properties) {
        this(properties.resolveEventLogPath());
    }

    JsonlEventLogSink(Path logPath) {
        this.logPath = logPath;
        try {
            Files.createDirectories(logPath.getParent());
        } catch (IOException e) {
            log.error("无法创建事件日志目录 {}", logPath.getParent(), e);
        }
    }

    @Override
    public void onEvent(EventRecord event) {
        ObjectNode record = event.payload().deepCopy();
        record.put(TIMESTAMP_FIELD, event.receivedAtEpochSeconds());
        try {
            String json = objectMapper.writeValueAsString(record);
            synchronized (this) {
                Files.writeString(
                        logPath,
                        json + "\n",
                        StandardCharsets.UTF_8,
                        StandardOpenOption.CREATE,
                        StandardOpenOption.APPEND);
            }
            log.debug("已记录 {} 事件，来自 {}", event.type(), record.path("from_id").asText("unknown"));
        } catch (IOException e) {
            log.error("写入事件日志 {} 失败: {}", logPath, e.getMessage());
        }
    }

    /**
     * 读取最近的若干条事件记录，按写入顺序 (从旧到新) 返回。无法解析的行会被跳过。
     */
    public List<JsonNode> readRecent(int limit) throws IOException {
        if (limit <= 0 || Files.notExists(logPath)) {
            return Collections.emptyList();
        }
        List<String> lines;
        try (var reader = ReversedLinesFileReader.builder()
                .setPath(logPath)
                .setCharset(StandardCharsets.UTF_8)
                .get()) {
            lines = reader.readLines(limit);
        }
        List<JsonNode> records = new ArrayList<>(lines.size());
        for (String line : lines) {
            if (line.isBlank()) {
                continue;
            }
            try {
                records.add(objectMapper.readTree(line));
            } catch (JsonProcessingException e) {
                log.warn("跳过事件日志中无法解析的一行: {}", e.getOriginalMessage());
            }
        }
        Collections.reverse(records);
        return records;
    }

    public Path getLogPath() {
        return logPath;
    }
}
