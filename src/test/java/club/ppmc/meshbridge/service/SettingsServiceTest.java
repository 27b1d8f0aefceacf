package club.ppmc.meshbridge.service;

import static org.assertj.core.api.Assertions.assertThat;

import club.ppmc.meshbridge.config.BridgeProperties;
import club.ppmc.meshbridge.model.InitSettings;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SettingsServiceTest {

    @TempDir
    Path tempDir;

    private SettingsService settingsService;

    @BeforeEach
    void setUp() {
        var properties = new BridgeProperties();
        properties.setConfigDir(tempDir.toString());
        settingsService = new SettingsService(properties);
    }

    @Test
    @DisplayName("Should use defaults when the settings file is missing")
    void loadSettings_MissingFile_Defaults() {
        InitSettings settings = settingsService.loadSettings();

        assertThat(settings.isManualAddContacts()).isFalse();
        assertThat(settingsService.getSettingsFilePath()).isEqualTo(tempDir.resolve(".webui_settings.json"));
    }

    @Test
    @DisplayName("Should read manual_add_contacts and ignore unknown keys")
    void loadSettings_ValidFile_Parsed() throws Exception {
        Files.writeString(settingsService.getSettingsFilePath(),
                "{\"manual_add_contacts\": true, \"theme\": \"dark\"}");

        assertThat(settingsService.loadSettings().isManualAddContacts()).isTrue();
    }

    @Test
    @DisplayName("Should fall back to defaults when the settings file is malformed")
    void loadSettings_MalformedFile_Defaults() throws Exception {
        Files.writeString(settingsService.getSettingsFilePath(), "{ manual_add_contacts: ");

        assertThat(settingsService.loadSettings().isManualAddContacts()).isFalse();
    }
}
