/**
 * SessionSupervisor.java
 *
 * 该服务持有唯一的 meshcli 会话，并负责它的整个生命周期。
 * 它启动进程和各个工作线程 (stdout 读取、stderr 读取、stdin 写入)，发送初始化命令，
 * 定时检查进程是否存活，并在进程意外退出时让所有待处理命令以 "crashed" 失败、然后从头重启会话。
 * 调用方通过 submit / execute 提交命令；提交永远不会阻塞在 meshcli 上。
 */
package club.ppmc.meshbridge.session;

import club.ppmc.meshbridge.config.BridgeProperties;
import club.ppmc.meshbridge.exception.SessionUnavailableException;
import club.ppmc.meshbridge.model.CommandResult;
import club.ppmc.meshbridge.model.FailureReason;
import club.ppmc.meshbridge.model.HealthStatus;
import club.ppmc.meshbridge.model.InitSettings;
import club.ppmc.meshbridge.model.SessionState;
import club.ppmc.meshbridge.service.SettingsService;
import club.ppmc.meshbridge.util.CommandLineEncoder;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

@Service
@Slf4j
public class SessionSupervisor {

    static final String CRASH_MESSAGE = "meshcli process crashed";
    static final String SHUTDOWN_MESSAGE = "meshcli bridge is shutting down";

    /** 每次会话启动都会发送的核心设置：JSON 日志、打印广播、订阅消息。 */
    static final List<String> CORE_INIT_COMMANDS =
            List.of("set json_log_rx on", "set print_adverts on", "msgs_subscribe");

    private static final long EXECUTE_GRACE_MILLIS = 1000;

    private final BridgeProperties properties;
    private final ProcessLauncher launcher;
    private final SettingsService settingsService;
    private final List<SessionEventListener> listeners;
    private final Clock clock;

    private final PendingCommandRegistry registry = new PendingCommandRegistry();
    private final ScheduledThreadPoolExecutor scheduler;
    private final ExecutorService workers = Executors.newCachedThreadPool();
    private final CompletionDetector completionDetector;

    private final Object lifecycleLock = new Object();
    private final AtomicLong generations = new AtomicLong();
    private final AtomicInteger restarts = new AtomicInteger();
    private volatile ManagedSession session;
    private volatile boolean startFailed;
    private volatile boolean stopped;

    public SessionSupervisor(
            BridgeProperties properties,
            ProcessLauncher launcher,
            SettingsService settingsService,
            List<SessionEventListener> listeners,
            Clock clock) {
        this.properties = properties;
        this.launcher = launcher;
        this.settingsService = settingsService;
        this.listeners = List.copyOf(listeners);
        this.clock = clock;
        this.scheduler = new ScheduledThreadPoolExecutor(2);
        this.scheduler.setRemoveOnCancelPolicy(true);
        this.completionDetector = new CompletionDetector(
                registry, scheduler, Duration.ofMillis(properties.getQuiescenceMillis()));
    }

    @PostConstruct
    public void init() {
        try {
            start();
        } catch (IOException | RuntimeException e) {
            log.error("启动 meshcli 会话失败，/cli 在会话恢复前不可用: {}", e.getMessage());
        }
    }

    /**
     * 启动一个新会话：启动进程和读取线程，等待 meshcli 初始化，发送初始化命令，
     * 进入 RUNNING 后再启动 stdin 写入线程。
     */
    public void start() throws IOException {
        synchronized (lifecycleLock) {
            if (stopped) {
                throw new SessionUnavailableException(SHUTDOWN_MESSAGE);
            }
            log.info("正在启动 meshcli 会话，串口: {}", properties.getSerialPort());
            Process process;
            try {
                process = launcher.launch();
            } catch (IOException | RuntimeException e) {
                startFailed = true;
                ManagedSession previous = session;
                if (previous != null) {
                    changeState(previous, SessionState.CRASHED);
                }
                throw e;
            }

            var newSession = new ManagedSession(generations.incrementAndGet(), process, clock.instant());
            session = newSession;
            startFailed = false;
            changeState(newSession, SessionState.STARTING);

            var classifier = new OutputClassifier(
                    properties.getEventDiscriminator(),
                    properties.getEventTypes(),
                    properties.getClassifierMaxLines(),
                    Duration.ofMillis(properties.getQuiescenceMillis()));
            var multiplexer = new OutputMultiplexer(newSession, classifier, registry, listeners, clock);
            newSession.attachWorker(workers.submit(multiplexer));
            newSession.attachWorker(workers.submit(new StderrLogger(newSession)));

            pause(properties.getInitDelayMillis());
            applyInitCommands(newSession);

            changeState(newSession, SessionState.RUNNING);
            newSession.attachWorker(workers.submit(
                    new CommandDispatcher(newSession, registry, completionDetector, multiplexer)));
            log.info("meshcli 会话 #{} 已就绪", newSession.getGeneration());
        }
    }

    /**
     * 定时检查进程是否存活。进程退出时让所有待处理命令失败并重启会话；
     * 上一次启动失败时在这里重试。
     */
    @Scheduled(
            fixedDelayString = "${bridge.health-check-interval-millis:5000}",
            initialDelayString = "${bridge.health-check-interval-millis:5000}")
    public void checkHealth() {
        if (stopped) {
            return;
        }
        ManagedSession current = session;
        if (current == null || startFailed) {
            restart();
            return;
        }
        if (current.getState() == SessionState.RUNNING && !current.isAlive()) {
            handleCrash(current);
        }
    }

    private void handleCrash(ManagedSession crashed) {
        log.error("meshcli 进程已退出 (退出码: {})", exitCodeOf(crashed.getProcess()));
        int failed = registry.failAll(
                FailureReason.SESSION_CRASHED, CRASH_MESSAGE, () -> crashed.setState(SessionState.CRASHED));
        notifyState(crashed);
        if (failed > 0) {
            log.warn("会话崩溃，{} 条待处理命令已被置为失败", failed);
        }
        crashed.stopWorkers();
        changeState(crashed, SessionState.RESTARTING);
        restarts.incrementAndGet();
        log.info("正在尝试重启 meshcli 会话...");
        restart();
    }

    private void restart() {
        try {
            start();
        } catch (IOException | RuntimeException e) {
            log.error("重启 meshcli 会话失败，将在下一次健康检查时重试: {}", e.getMessage());
        }
    }

    /**
     * 提交一条命令，立即返回。
     *
     * @throws club.ppmc.meshbridge.exception.MalformedCommandException 命令无法编码为一行输入。
     * @throws SessionUnavailableException 服务已关闭。
     */
    public Command submit(List<String> args, Duration timeout) {
        if (stopped) {
            throw new SessionUnavailableException(SHUTDOWN_MESSAGE);
        }
        String line = CommandLineEncoder.encode(args);
        var command = new Command(newCommandId(), line, timeout);
        registry.enqueue(command);
        completionDetector.scheduleTimeout(command);
        log.info("命令 [{}] 已入队: {}", command.getId(), line);
        return command;
    }

    /**
     * 提交一条命令并同步等待结果，最长等待时间为命令的超时时间。
     */
    public CommandResult execute(List<String> args, Duration timeout) {
        Command command = submit(args, timeout);
        try {
            return command.getCompletion().get(timeout.toMillis() + EXECUTE_GRACE_MILLIS, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            // 超时定时器未能运行 (例如调度器已关闭)，由调用线程自己让命令超时
            registry.expire(command);
            return command.getCompletion().join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            registry.expire(command);
            return command.getCompletion().join();
        } catch (ExecutionException e) {
            throw new IllegalStateException("Command [" + command.getId() + "] completed exceptionally", e.getCause());
        }
    }

    public SessionState currentState() {
        if (stopped) {
            return SessionState.STOPPED;
        }
        ManagedSession current = session;
        if (current == null) {
            return startFailed ? SessionState.CRASHED : SessionState.STARTING;
        }
        return startFailed ? SessionState.CRASHED : current.getState();
    }

    public HealthStatus health() {
        ManagedSession current = session;
        SessionState state = currentState();
        boolean healthy = state == SessionState.RUNNING && current != null && current.isAlive();
        return new HealthStatus(
                healthy ? "healthy" : "unhealthy",
                state,
                properties.getSerialPort(),
                properties.getDeviceName(),
                properties.resolveEventLogPath().toString(),
                current != null ? current.pid() : null,
                current != null ? current.getGeneration() : 0,
                restarts.get(),
                registry.size());
    }

    ManagedSession currentSession() {
        return session;
    }

    PendingCommandRegistry registry() {
        return registry;
    }

    /**
     * 优雅关闭：让所有待处理命令失败，请求进程退出，超时后强制终止，并停止所有工作线程。
     */
    @PreDestroy
    public void shutdown() {
        synchronized (lifecycleLock) {
            if (stopped) {
                return;
            }
            stopped = true;
        }
        log.info("正在关闭 meshcli 会话...");
        ManagedSession current = session;
        registry.close(FailureReason.SHUTDOWN, SHUTDOWN_MESSAGE, () -> {
            if (current != null) {
                current.setState(SessionState.STOPPED);
            }
        });
        if (current != null) {
            notifyState(current);
            current.stopWorkers();
            terminate(current.getProcess());
        }
        scheduler.shutdownNow();
        workers.shutdownNow();
        log.info("meshcli 会话已关闭");
    }

    List<String> buildInitCommands(InitSettings settings) {
        List<String> commands = new ArrayList<>(CORE_INIT_COMMANDS);
        if (settings.isManualAddContacts()) {
            commands.add("set manual_add_contacts on");
        }
        return commands;
    }

    /** 初始化命令直接写入 stdin，不经过命令队列，也不收集输出。 */
    private void applyInitCommands(ManagedSession target) {
        InitSettings settings = settingsService.loadSettings();
        List<String> commands = buildInitCommands(settings);
        try {
            for (String command : commands) {
                target.writeLine(command);
            }
            log.info("会话初始化命令已发送: {}", commands);
        } catch (IOException e) {
            log.error("发送会话初始化命令失败: {}", e.getMessage());
        }
    }

    private void terminate(Process process) {
        process.destroy();
        try {
            if (!process.waitFor(properties.getShutdownGraceMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("meshcli 未在 {} ms 内退出，强制终止", properties.getShutdownGraceMillis());
                process.destroyForcibly();
            }
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
        }
    }

    private void changeState(ManagedSession target, SessionState state) {
        target.setState(state);
        notifyState(target);
    }

    private void notifyState(ManagedSession target) {
        SessionState state = target.getState();
        log.info("会话 #{} 状态: {}", target.getGeneration(), state);
        for (SessionEventListener listener : listeners) {
            try {
                listener.onStateChange(target.getGeneration(), state);
            } catch (RuntimeException e) {
                log.warn("状态监听器 {} 出错: {}", listener.getClass().getSimpleName(), e.getMessage());
            }
        }
    }

    private void pause(long millis) {
        if (millis <= 0) {
            return;
        }
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static String newCommandId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }

    private static String exitCodeOf(Process process) {
        try {
            return String.valueOf(process.exitValue());
        } catch (IllegalThreadStateException e) {
            return "unknown";
        }
    }
}
