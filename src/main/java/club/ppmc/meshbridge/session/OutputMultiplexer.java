/**
 * OutputMultiplexer.java
 *
 * 会话的 stdout 读取循环。逐行读取 meshcli 的输出，经 OutputClassifier 分类后：
 * 事件交给各个 SessionEventListener，响应内容追加到执行中的命令。
 * 没有执行中的命令时，响应内容 (通常是启动输出) 被丢弃。
 * 分类器由读取线程和 CompletionDetector 的检查共同使用，访问都在 classifier 上同步。
 */
package club.ppmc.meshbridge.session;

import club.ppmc.meshbridge.model.EventRecord;
import club.ppmc.meshbridge.model.SessionState;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class OutputMultiplexer implements Runnable {

    private final ManagedSession session;
    private final OutputClassifier classifier;
    private final PendingCommandRegistry registry;
    private final List<SessionEventListener> listeners;
    private final Clock clock;

    public OutputMultiplexer(
            ManagedSession session,
            OutputClassifier classifier,
            PendingCommandRegistry registry,
            List<SessionEventListener> listeners,
            Clock clock) {
        this.session = session;
        this.classifier = classifier;
        this.registry = registry;
        this.listeners = listeners;
        this.clock = clock;
    }

    @Override
    public void run() {
        log.info("会话 #{} 的 stdout 读取线程已启动", session.getGeneration());
        try (var reader = new BufferedReader(
                new InputStreamReader(session.getProcess().getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.isEmpty()) {
                    continue;
                }
                synchronized (classifier) {
                    route(classifier.accept(line));
                    if (classifier.isAccumulating()) {
                        // 未闭合的记录可能是响应内容，不能让命令在此期间被判定为完成
                        registry.touchInFlight();
                    }
                }
            }
            synchronized (classifier) {
                route(classifier.flush());
            }
        } catch (IOException e) {
            if (session.getState() == SessionState.RUNNING) {
                log.error("读取会话 #{} 的 stdout 时出错: {}", session.getGeneration(), e.getMessage());
            } else {
                log.debug("会话 #{} 的 stdout 已关闭: {}", session.getGeneration(), e.getMessage());
            }
        } finally {
            log.info("会话 #{} 的 stdout 读取线程已退出", session.getGeneration());
        }
    }

    /**
     * 释放空闲超过静默阈值仍未闭合的候选记录，作为响应内容交给执行中的命令。
     * 在判断命令是否完成之前调用。释放的行不刷新命令的活动时间。
     */
    public void releaseStaleCandidate() {
        synchronized (classifier) {
            for (ClassifiedLine line : classifier.releaseIfIdle(System.nanoTime())) {
                if (!registry.appendReleased(line.text())) {
                    log.debug("未关联到任何命令的输出: {}", line.text());
                }
            }
        }
    }

    void route(List<ClassifiedLine> lines) {
        for (ClassifiedLine line : lines) {
            if (line.isEvent()) {
                publish(new EventRecord(line.eventType(), line.payload(), clock.instant()));
            } else if (!registry.appendOutput(line.text())) {
                log.debug("未关联到任何命令的输出: {}", line.text());
            }
        }
    }

    private void publish(EventRecord event) {
        for (SessionEventListener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                log.error("事件监听器 {} 处理 {} 事件失败", listener.getClass().getSimpleName(), event.type(), e);
            }
        }
    }
}
