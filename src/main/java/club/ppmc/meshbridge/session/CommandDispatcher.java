/**
 * CommandDispatcher.java
 *
 * 会话的 stdin 写入循环。按提交顺序取出排队的命令，等待执行槽位空闲后写入 meshcli，
 * 然后交给 CompletionDetector 监视。上一条命令释放槽位之前不会写入下一条。
 * 所属会话不再处于 RUNNING 状态时循环结束。
 */
package club.ppmc.meshbridge.session;

import club.ppmc.meshbridge.model.SessionState;
import java.io.IOException;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class CommandDispatcher implements Runnable {

    private final ManagedSession session;
    private final PendingCommandRegistry registry;
    private final CompletionDetector completionDetector;
    private final OutputMultiplexer multiplexer;

    public CommandDispatcher(
            ManagedSession session,
            PendingCommandRegistry registry,
            CompletionDetector completionDetector,
            OutputMultiplexer multiplexer) {
        this.session = session;
        this.registry = registry;
        this.completionDetector = completionDetector;
        this.multiplexer = multiplexer;
    }

    @Override
    public void run() {
        log.info("会话 #{} 的 stdin 写入线程已启动", session.getGeneration());
        try {
            while (session.getState() == SessionState.RUNNING && !Thread.currentThread().isInterrupted()) {
                Command command = registry.pollQueued(1, TimeUnit.SECONDS);
                if (command == null || !registry.beginDispatch(command, session)) {
                    continue;
                }
                send(command);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            log.info("会话 #{} 的 stdin 写入线程已退出", session.getGeneration());
        }
    }

    private void send(Command command) {
        log.info("发送命令 [{}]: {}", command.getId(), command.getLine());
        try {
            session.writeLine(command.getLine());
            completionDetector.watch(command, multiplexer::releaseStaleCandidate);
        } catch (IOException e) {
            log.error("发送命令 [{}] 失败: {}", command.getId(), e.getMessage());
            registry.failDispatch(command, "Failed to write command: " + e.getMessage());
        }
    }
}
