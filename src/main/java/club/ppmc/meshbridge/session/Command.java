/**
 * Command.java
 *
 * 调用方提交的一条命令。
 * 状态只沿 QUEUED → IN_FLIGHT → TERMINAL 前进一次；会话崩溃或超时可以让它提前进入 TERMINAL。
 * 除 completion 之外的可变状态都由 PendingCommandRegistry 的锁保护。
 */
package club.ppmc.meshbridge.session;

import club.ppmc.meshbridge.model.CommandResult;
import club.ppmc.meshbridge.model.FailureReason;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import lombok.Getter;

@Getter
public final class Command {

    public enum State {
        QUEUED,
        IN_FLIGHT,
        TERMINAL
    }

    private final String id;
    private final String line;
    private final Duration timeout;
    private final CompletableFuture<CommandResult> completion = new CompletableFuture<>();

    private final List<String> output = new ArrayList<>();
    private volatile long lastActivityNanos;
    private volatile State state = State.QUEUED;

    Command(String id, String line, Duration timeout) {
        this.id = id;
        this.line = line;
        this.timeout = timeout;
        this.lastActivityNanos = System.nanoTime();
    }

    public List<String> getOutput() {
        return Collections.unmodifiableList(output);
    }

    public boolean isTerminal() {
        return completion.isDone();
    }

    void markInFlight(long nowNanos) {
        this.state = State.IN_FLIGHT;
        this.lastActivityNanos = nowNanos;
    }

    void append(String text, long nowNanos) {
        output.add(text);
        this.lastActivityNanos = nowNanos;
    }

    void touch(long nowNanos) {
        this.lastActivityNanos = nowNanos;
    }

    /**
     * @return 如果这次调用让命令进入了终态，返回 true。
     */
    boolean succeed() {
        return finish(CommandResult.success(String.join("\n", output)));
    }

    boolean fail(FailureReason reason, String message) {
        return finish(CommandResult.failure(reason, message));
    }

    String describeTimeout() {
        long millis = timeout.toMillis();
        if (millis % 1000 == 0) {
            return "Command timeout after " + (millis / 1000) + " seconds";
        }
        return "Command timeout after " + millis + " ms";
    }

    private boolean finish(CommandResult result) {
        if (completion.complete(result)) {
            this.state = State.TERMINAL;
            return true;
        }
        return false;
    }

    @Override
    public String toString() {
        return "Command[" + id + "]: " + line;
    }
}
