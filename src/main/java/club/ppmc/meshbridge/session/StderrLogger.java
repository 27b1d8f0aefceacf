/**
 * StderrLogger.java
 *
 * 会话的 stderr 读取循环。只用于诊断，每一行都以 WARN 级别记录。
 */
package club.ppmc.meshbridge.session;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class StderrLogger implements Runnable {

    private final ManagedSession session;

    public StderrLogger(ManagedSession session) {
        this.session = session;
    }

    @Override
    public void run() {
        try (var reader = new BufferedReader(
                new InputStreamReader(session.getProcess().getErrorStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (!line.isEmpty()) {
                    log.warn("meshcli stderr: {}", line);
                }
            }
        } catch (IOException e) {
            log.debug("会话 #{} 的 stderr 已关闭: {}", session.getGeneration(), e.getMessage());
        }
    }
}
