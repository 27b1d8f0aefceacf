/**
 * SettingsController.java
 *
 * 只读地返回会话初始化设置 (与下一次会话启动时读到的内容一致)。
 * 设置文件由 Web 应用写入，这里不提供修改接口。
 */
package club.ppmc.meshbridge.controller;

import club.ppmc.meshbridge.model.InitSettings;
import club.ppmc.meshbridge.service.SettingsService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class SettingsController {

    private final SettingsService settingsService;

    public SettingsController(SettingsService settingsService) {
        this.settingsService = settingsService;
    }

    @GetMapping("/settings")
    public ResponseEntity<InitSettings> getSettings() {
        return ResponseEntity.ok(settingsService.loadSettings());
    }
}
