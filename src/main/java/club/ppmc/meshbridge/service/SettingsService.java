/**
 * SettingsService.java
 *
 * 读取 Web 应用持久化在配置目录中的 .webui_settings.json。
 * 该文件由 Web 应用负责写入；桥接服务只在每次会话启动时读取一次，用于决定要发送哪些初始化命令。
 * 文件不存在或无法解析时使用默认设置，不会阻止会话启动。
 */
package club.ppmc.meshbridge.service;

import club.ppmc.meshbridge.config.BridgeProperties;
import club.ppmc.meshbridge.model.InitSettings;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class SettingsService {

    private static final Logger LOGGER = LoggerFactory.getLogger(SettingsService.class);
    private static final String SETTINGS_FILE_NAME = ".webui_settings.json";

    private final Path settingsFilePath;
    private final ObjectMapper objectMapper;

    public SettingsService(BridgeProperties properties) {
        this.settingsFilePath = properties.resolveConfigDir().resolve(SETTINGS_FILE_NAME);
        this.objectMapper = new ObjectMapper();
    }

    public InitSettings loadSettings() {
        if (Files.notExists(settingsFilePath)) {
            LOGGER.info("未找到设置文件 {}，使用默认设置。", settingsFilePath);
            return new InitSettings();
        }
        try {
            byte[] jsonData = Files.readAllBytes(settingsFilePath);
            InitSettings settings = objectMapper.readValue(jsonData, InitSettings.class);
            LOGGER.info("已从 {} 加载设置: {}", settingsFilePath, settings);
            return settings;
        } catch (IOException e) {
            LOGGER.error("读取设置文件 {} 失败，使用默认设置。", settingsFilePath, e);
            return new InitSettings();
        }
    }

    public Path getSettingsFilePath() {
        return settingsFilePath;
    }
}
