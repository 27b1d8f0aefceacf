package club.ppmc.meshbridge.session;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * 内存中的 meshcli 进程替身：记录写入 stdin 的每一行，并由测试控制 stdout/stderr 的输出和进程退出。
 */
class FakeMeshCliProcess extends Process {

    private final BlockingQueue<String> stdinLines = new LinkedBlockingQueue<>();
    private final LineInputStream stdout = new LineInputStream();
    private final LineInputStream stderr = new LineInputStream();
    private final OutputStream stdin = new CapturingOutputStream();
    private final CountDownLatch exited = new CountDownLatch(1);
    private final long pid;
    private volatile int exitCode = -1;

    FakeMeshCliProcess(long pid) {
        this.pid = pid;
    }

    void emit(String... lines) {
        for (String line : lines) {
            stdout.push(line + "\n");
        }
    }

    void emitStderr(String line) {
        stderr.push(line + "\n");
    }

    /** 下一行写入 stdin 的内容；超时未到达时返回 null。 */
    String nextStdinLine(long timeoutMillis) throws InterruptedException {
        return stdinLines.poll(timeoutMillis, TimeUnit.MILLISECONDS);
    }

    /** 跳过会话初始化命令，返回之后写入的第一行。 */
    String nextCommandLine(long timeoutMillis) throws InterruptedException {
        String line;
        do {
            line = nextStdinLine(timeoutMillis);
        } while (line != null && SessionSupervisor.CORE_INIT_COMMANDS.contains(line));
        return line;
    }

    void crash(int code) {
        exitCode = code;
        stdout.end();
        stderr.end();
        exited.countDown();
    }

    @Override
    public OutputStream getOutputStream() {
        return stdin;
    }

    @Override
    public InputStream getInputStream() {
        return stdout;
    }

    @Override
    public InputStream getErrorStream() {
        return stderr;
    }

    @Override
    public int waitFor() throws InterruptedException {
        exited.await();
        return exitCode;
    }

    @Override
    public boolean waitFor(long timeout, TimeUnit unit) throws InterruptedException {
        return exited.await(timeout, unit);
    }

    @Override
    public int exitValue() {
        if (exited.getCount() > 0) {
            throw new IllegalThreadStateException("process has not exited");
        }
        return exitCode;
    }

    @Override
    public boolean isAlive() {
        return exited.getCount() > 0;
    }

    @Override
    public void destroy() {
        crash(143);
    }

    @Override
    public long pid() {
        return pid;
    }

    private final class CapturingOutputStream extends OutputStream {

        private final ByteArrayOutputStream current = new ByteArrayOutputStream();

        @Override
        public synchronized void write(int b) throws IOException {
            if (!isAlive()) {
                throw new IOException("Broken pipe");
            }
            if (b == '\n') {
                stdinLines.add(current.toString(StandardCharsets.UTF_8));
                current.reset();
            } else {
                current.write(b);
            }
        }
    }

    private static final class LineInputStream extends InputStream {

        private static final int EOF = -1;
        private final BlockingQueue<Integer> bytes = new LinkedBlockingQueue<>();
        private volatile boolean ended;

        void push(String text) {
            for (byte b : text.getBytes(StandardCharsets.UTF_8)) {
                bytes.add(b & 0xFF);
            }
        }

        void end() {
            bytes.add(EOF);
        }

        @Override
        public int read() throws IOException {
            if (ended) {
                return EOF;
            }
            try {
                int value = bytes.take();
                if (value == EOF) {
                    ended = true;
                }
                return value;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IOException("interrupted", e);
            }
        }

        @Override
        public int read(byte[] buffer, int offset, int length) throws IOException {
            if (length == 0) {
                return 0;
            }
            int first = read();
            if (first == EOF) {
                return EOF;
            }
            buffer[offset] = (byte) first;
            int count = 1;
            while (count < length) {
                Integer next = bytes.peek();
                if (next == null || next == EOF) {
                    break;
                }
                buffer[offset + count] = (byte) (int) bytes.poll();
                count++;
            }
            return count;
        }

        @Override
        public int available() {
            return bytes.size();
        }
    }
}
