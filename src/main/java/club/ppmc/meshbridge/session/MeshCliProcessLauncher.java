/**
 * MeshCliProcessLauncher.java
 *
 * 以 `meshcli -s <串口>` 启动真实的 meshcli 进程。
 */
package club.ppmc.meshbridge.session;

import club.ppmc.meshbridge.config.BridgeProperties;
import java.io.IOException;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Component
@Slf4j
public class MeshCliProcessLauncher implements ProcessLauncher {

    private final BridgeProperties properties;

    public MeshCliProcessLauncher(BridgeProperties properties) {
        this.properties = properties;
    }

    @Override
    public Process launch() throws IOException {
        List<String> command = List.of(properties.getExecutable(), "-s", properties.getSerialPort());
        var processBuilder = new ProcessBuilder(command)
                .redirectInput(ProcessBuilder.Redirect.PIPE)
                .redirectOutput(ProcessBuilder.Redirect.PIPE)
                .redirectError(ProcessBuilder.Redirect.PIPE);
        // meshcli 是 Python 程序，输出到管道时默认块缓冲，会让基于静默的完成判断失效
        processBuilder.environment().put("PYTHONUNBUFFERED", "1");

        Process process = processBuilder.start();
        log.info("meshcli 进程已启动 (PID: {})，命令: {}", process.pid(), String.join(" ", command));
        return process;
    }
}
