/**
 * BridgeProperties.java
 *
 * 桥接服务的全部可配置项，由 application.properties 中 "bridge." 前缀下的键绑定而来。
 * 它是一个可变的POJO，便于Spring进行属性绑定，也便于在测试中直接构造。
 */
package club.ppmc.meshbridge.config;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;

@Data
public class BridgeProperties {

    /** meshcli 可执行文件的名称或绝对路径。 */
    private String executable = "meshcli";

    /** meshcli 连接的串口设备路径。 */
    private String serialPort = "/dev/ttyUSB0";

    /**
     * 配置目录。事件日志 (.adverts.jsonl) 和 .webui_settings.json 都存放在这里。
     */
    private String configDir = "/config";

    /** 设备名称，决定事件日志的文件名。 */
    private String deviceName = "meshtastic";

    // --- 命令执行 ---
    private int defaultTimeoutSeconds = 10;

    /** "recv" 命令在调用方未指定超时时使用的默认超时。 */
    private int recvTimeoutSeconds = 60;

    /**
     * 静默阈值 (毫秒)。某条命令的输出在这段时间内没有新行到达，即视为输出结束。
     */
    private long quiescenceMillis = 300;

    // --- 会话生命周期 ---
    private long healthCheckIntervalMillis = 5000;

    /** 进程启动后，发送初始化命令之前的等待时间。 */
    private long initDelayMillis = 500;

    /** 优雅关闭时等待进程退出的时间，超时后强制终止。 */
    private long shutdownGraceMillis = 5000;

    // --- 事件分类 ---
    /** 用于识别异步事件的 JSON 字段名。 */
    private String eventDiscriminator = "payload_typename";

    /** 被视为异步事件的判别字段取值。 */
    private List<String> eventTypes = new ArrayList<>(List.of("ADVERT"));

    /** 多行 JSON 记录最多缓冲的物理行数，超过即按普通响应内容处理。 */
    private int classifierMaxLines = 200;

    public Path resolveConfigDir() {
        return Paths.get(configDir).toAbsolutePath().normalize();
    }

    public Path resolveEventLogPath() {
        return resolveConfigDir().resolve(deviceName + ".adverts.jsonl");
    }
}
