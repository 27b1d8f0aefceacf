/**
 * CompletionDetector.java
 *
 * meshcli 没有"输出结束"标记，命令是否完成只能根据输出静默的时间推断。
 * 每条执行中的命令有一个一次性定时器，它在 "最后活动时间 + 静默阈值" 时检查，
 * 若期间又有新行到达则按剩余时间重新安排。
 * 调用方的超时也由这里安排，从提交时开始计时。
 */
package club.ppmc.meshbridge.session;

import java.time.Duration;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class CompletionDetector {

    private final PendingCommandRegistry registry;
    private final ScheduledExecutorService scheduler;
    private final long quiescenceNanos;

    public CompletionDetector(
            PendingCommandRegistry registry, ScheduledExecutorService scheduler, Duration quiescence) {
        this.registry = registry;
        this.scheduler = scheduler;
        this.quiescenceNanos = quiescence.toNanos();
    }

    /**
     * 命令写入 stdin 之后调用。
     *
     * @param beforeCheck 每次检查前执行，用于把空闲的未闭合候选记录交给命令。
     */
    public void watch(Command command, Runnable beforeCheck) {
        schedule(command, beforeCheck, quiescenceNanos);
    }

    /** 命令入队时调用。命令进入终态后定时器会被取消。 */
    public void scheduleTimeout(Command command) {
        try {
            ScheduledFuture<?> timer = scheduler.schedule(
                    () -> registry.expire(command), command.getTimeout().toNanos(), TimeUnit.NANOSECONDS);
            command.getCompletion().whenComplete((result, error) -> timer.cancel(false));
        } catch (RejectedExecutionException e) {
            log.debug("调度器已关闭，无法为命令 [{}] 安排超时", command.getId());
        }
    }

    private void schedule(Command command, Runnable beforeCheck, long delayNanos) {
        try {
            scheduler.schedule(() -> check(command, beforeCheck), delayNanos, TimeUnit.NANOSECONDS);
        } catch (RejectedExecutionException e) {
            log.debug("调度器已关闭，停止监视命令 [{}]", command.getId());
        }
    }

    private void check(Command command, Runnable beforeCheck) {
        beforeCheck.run();
        long remaining = registry.completeIfQuiescent(command, quiescenceNanos);
        if (remaining > 0) {
            schedule(command, beforeCheck, remaining);
        }
    }
}
