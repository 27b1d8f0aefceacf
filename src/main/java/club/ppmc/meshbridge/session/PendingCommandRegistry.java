/**
 * PendingCommandRegistry.java
 *
 * 所有排队中和执行中命令的登记表，以及 FIFO 队列和唯一的"执行中"槽位。
 * Dispatcher、Multiplexer、CompletionDetector 和 Supervisor 共享同一把锁：
 * 进程崩溃可能与某条命令的完成同时被检测到。
 * 槽位被占用期间不会派发下一条命令；即使占用者已经因超时进入终态，也要等到输出静默才释放槽位。
 */
package club.ppmc.meshbridge.session;

import club.ppmc.meshbridge.exception.SessionUnavailableException;
import club.ppmc.meshbridge.model.FailureReason;
import club.ppmc.meshbridge.model.SessionState;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.BlockingDeque;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class PendingCommandRegistry {

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition slotFree = lock.newCondition();
    private final BlockingDeque<Command> queue = new LinkedBlockingDeque<>();
    private final Map<String, Command> pending = new LinkedHashMap<>();

    private Command inFlight;
    private boolean closed;

    public void enqueue(Command command) {
        lock.lock();
        try {
            if (closed) {
                throw new SessionUnavailableException("meshcli bridge is shutting down");
            }
            pending.put(command.getId(), command);
            queue.offerLast(command);
        } finally {
            lock.unlock();
        }
    }

    Command pollQueued(long timeout, TimeUnit unit) throws InterruptedException {
        return queue.pollFirst(timeout, unit);
    }

    /**
     * 等待槽位空闲，然后把命令标记为执行中。
     *
     * @return 如果命令已经成为执行中的命令，返回 true；命令已是终态或会话已不在运行时返回 false。
     *     后一种情况下命令会被放回队首，由下一个会话的 Dispatcher 处理。
     */
    boolean beginDispatch(Command command, ManagedSession session) throws InterruptedException {
        lock.lock();
        try {
            while (inFlight != null && session.getState() == SessionState.RUNNING) {
                try {
                    slotFree.await(200, TimeUnit.MILLISECONDS);
                } catch (InterruptedException e) {
                    requeue(command);
                    throw e;
                }
            }
            if (command.isTerminal()) {
                pending.remove(command.getId());
                return false;
            }
            if (session.getState() != SessionState.RUNNING) {
                requeue(command);
                return false;
            }
            inFlight = command;
            command.markInFlight(System.nanoTime());
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 把一行响应内容追加到执行中的命令。
     *
     * @return 没有执行中的命令时返回 false，这一行会被丢弃。
     */
    public boolean appendOutput(String line) {
        lock.lock();
        try {
            if (inFlight == null) {
                return false;
            }
            inFlight.append(line, System.nanoTime());
            if (inFlight.isTerminal()) {
                log.debug("命令 [{}] 已超时，丢弃迟到的输出: {}", inFlight.getId(), line);
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 追加一行早先被缓冲、现在才确定为响应内容的输出。不刷新命令的活动时间。
     *
     * @return 没有执行中的命令时返回 false。
     */
    public boolean appendReleased(String line) {
        lock.lock();
        try {
            if (inFlight == null) {
                return false;
            }
            inFlight.append(line, inFlight.getLastActivityNanos());
            return true;
        } finally {
            lock.unlock();
        }
    }

    /** 刷新执行中命令的活动时间，但不追加内容。 */
    public void touchInFlight() {
        lock.lock();
        try {
            if (inFlight != null) {
                inFlight.touch(System.nanoTime());
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * 检查执行中的命令是否已静默足够久。静默时命令成功结束 (若尚未因超时结束) 并释放槽位。
     *
     * @return 还需等待的纳秒数；0 表示检查已结束，不需要再安排下一次检查。
     */
    long completeIfQuiescent(Command command, long quiescenceNanos) {
        lock.lock();
        try {
            if (inFlight != command) {
                return 0;
            }
            long idle = System.nanoTime() - command.getLastActivityNanos();
            if (idle < quiescenceNanos) {
                return quiescenceNanos - idle;
            }
            if (command.succeed()) {
                log.info("命令 [{}] 已完成 (静默 {} ms)", command.getId(), TimeUnit.NANOSECONDS.toMillis(idle));
            } else {
                log.info("已超时的命令 [{}] 输出静默，释放执行槽位", command.getId());
            }
            release(command);
            return 0;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 调用方的超时到期。排队中的命令直接移除；执行中的命令进入终态，但继续占用槽位。
     */
    public void expire(Command command) {
        lock.lock();
        try {
            if (!command.fail(FailureReason.TIMEOUT, command.describeTimeout())) {
                return;
            }
            if (inFlight == command) {
                log.warn("命令 [{}] 超时，meshcli 可能仍在输出，槽位保持占用直到静默", command.getId());
            } else {
                log.warn("命令 [{}] 在排队期间超时", command.getId());
                pending.remove(command.getId());
                queue.remove(command);
            }
        } finally {
            lock.unlock();
        }
    }

    /** 写入标准输入失败时调用。 */
    void failDispatch(Command command, String message) {
        lock.lock();
        try {
            command.fail(FailureReason.WRITE_FAILED, message);
            if (inFlight == command) {
                release(command);
            } else {
                pending.remove(command.getId());
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * 让所有排队中和执行中的命令以同一原因失败，并清空登记表。
     *
     * @param underLock 在持有锁期间、失败命令之前执行的动作，用于原子地切换会话状态。
     * @return 被置为失败的命令数量。
     */
    public int failAll(FailureReason reason, String message, Runnable underLock) {
        lock.lock();
        try {
            underLock.run();
            int failed = 0;
            for (Command command : pending.values()) {
                if (command.fail(reason, message)) {
                    failed++;
                }
            }
            pending.clear();
            queue.clear();
            inFlight = null;
            slotFree.signalAll();
            return failed;
        } finally {
            lock.unlock();
        }
    }

    /** 与 failAll 相同，并且之后拒绝任何新的命令。 */
    public int close(FailureReason reason, String message, Runnable underLock) {
        lock.lock();
        try {
            closed = true;
            return failAll(reason, message, underLock);
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return pending.size();
        } finally {
            lock.unlock();
        }
    }

    public Command currentInFlight() {
        lock.lock();
        try {
            return inFlight;
        } finally {
            lock.unlock();
        }
    }

    private void requeue(Command command) {
        if (!command.isTerminal()) {
            queue.offerFirst(command);
        }
    }

    private void release(Command command) {
        int late = command.getOutput().size();
        pending.remove(command.getId());
        inFlight = null;
        slotFree.signalAll();
        if (command.getCompletion().join().success()) {
            return;
        }
        log.debug("命令 [{}] 的槽位已释放，共缓冲 {} 行未交付的输出", command.getId(), late);
    }
}
