/**
 * ProcessLauncher.java
 *
 * 启动受管进程的策略。默认实现启动真实的 meshcli；测试中可替换为模拟进程。
 */
package club.ppmc.meshbridge.session;

import java.io.IOException;

@FunctionalInterface
public interface ProcessLauncher {

    /**
     * 启动一个新的受管进程，标准输入、输出和错误流都必须是管道。
     */
    Process launch() throws IOException;
}
