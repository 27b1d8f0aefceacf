/**
 * ManagedSession.java
 *
 * 一次 meshcli 进程生命周期的句柄：进程本身、标准输入写入器、状态和属于它的工作线程。
 * 只由 SessionSupervisor 创建和切换状态；其他组件只持有自己所属会话的句柄，
 * 因此重启时旧的工作线程能通过状态发现自己已经过期。
 */
package club.ppmc.meshbridge.session;

import club.ppmc.meshbridge.model.SessionState;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Future;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Getter
public class ManagedSession {

    private final long generation;
    private final Process process;
    private final Instant startedAt;
    private volatile SessionState state = SessionState.STARTING;

    private final BufferedWriter stdin;
    private final List<Future<?>> workers = new CopyOnWriteArrayList<>();

    ManagedSession(long generation, Process process, Instant startedAt) {
        this.generation = generation;
        this.process = process;
        this.startedAt = startedAt;
        this.stdin = new BufferedWriter(new OutputStreamWriter(process.getOutputStream(), StandardCharsets.UTF_8));
    }

    void setState(SessionState state) {
        this.state = state;
    }

    public boolean isAlive() {
        return process.isAlive();
    }

    public Long pid() {
        try {
            return process.pid();
        } catch (UnsupportedOperationException e) {
            return null;
        }
    }

    /** 写入一行并立即刷新。调用方的行内不能含行终止符。 */
    void writeLine(String line) throws IOException {
        synchronized (stdin) {
            stdin.write(line);
            stdin.write('\n');
            stdin.flush();
        }
    }

    void attachWorker(Future<?> worker) {
        workers.add(worker);
    }

    /** 取消属于本会话的工作线程并关闭标准输入。 */
    void stopWorkers() {
        workers.forEach(worker -> worker.cancel(true));
        workers.clear();
        try {
            synchronized (stdin) {
                stdin.close();
            }
        } catch (IOException e) {
            log.warn("关闭会话 #{} 的标准输入时出错: {}", generation, e.getMessage());
        }
    }
}
