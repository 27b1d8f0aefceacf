/**
 * OutputClassifier.java
 *
 * 判断 meshcli 的每一行输出是异步事件还是当前命令的响应内容。
 *
 * <p>以 '{' 开头的行会开启一个候选记录。分类器跨行跟踪括号深度 (忽略 JSON 字符串内的括号)，
 * 只有在结构闭合后才把整段文本作为一个整体解析：解析成功、是 JSON 对象、且判别字段取值被识别时，
 * 整段是一个事件；否则每个物理行都按响应内容处理。</p>
 *
 * <p>候选记录的缓冲同时受行数和时间限制。以下情况下已缓冲的行按响应内容释放，不会被丢弃：
 * 超过最大行数仍未闭合；距上一行已超过空闲窗口 (与命令的静默阈值相同)；
 * 或者新的一行本身就是一个完整的事件。</p>
 *
 * <p>已知限制：如果某条命令的正常输出恰好是带有被识别判别字段的 JSON 对象，它会被当作事件。</p>
 *
 * <p>非线程安全。调用方 (OutputMultiplexer) 负责同步。</p>
 */
package club.ppmc.meshbridge.session;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class OutputClassifier {

    private final ObjectMapper objectMapper;
    private final String discriminator;
    private final Set<String> eventTypes;
    private final int maxLines;
    private final long idleNanos;

    private final List<String> candidate = new ArrayList<>();
    private int depth;
    private long lastLineNanos;

    public OutputClassifier(String discriminator, Collection<String> eventTypes, int maxLines, Duration idleWindow) {
        this.objectMapper = new ObjectMapper().enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
        this.discriminator = discriminator;
        this.eventTypes = Set.copyOf(eventTypes);
        this.maxLines = Math.max(1, maxLines);
        this.idleNanos = idleWindow.toNanos();
    }

    public List<ClassifiedLine> accept(String line) {
        return accept(line, System.nanoTime());
    }

    /**
     * 接收一个物理行。
     *
     * @param nowNanos 这一行到达的时刻 ({@link System#nanoTime()})。
     * @return 本次可以确定分类的行，按原始顺序排列；候选记录尚未闭合时为空列表。
     */
    List<ClassifiedLine> accept(String line, long nowNanos) {
        List<ClassifiedLine> result = new ArrayList<>();
        if (!candidate.isEmpty() && (nowNanos - lastLineNanos >= idleNanos || isStandaloneEvent(line))) {
            log.debug("候选记录在第 {} 行处中断，按响应内容处理", candidate.size());
            result.addAll(release());
        }
        lastLineNanos = nowNanos;

        if (candidate.isEmpty()) {
            if (!startsCandidate(line)) {
                result.add(ClassifiedLine.response(line));
                return result;
            }
            depth = 0;
        }
        candidate.add(line);
        depth += depthDelta(line);

        if (depth <= 0) {
            result.addAll(evaluate());
        } else if (candidate.size() >= maxLines) {
            log.debug("候选记录超过 {} 行仍未闭合，按响应内容处理", maxLines);
            result.addAll(release());
        }
        return result;
    }

    /** 输出流结束时调用，释放尚未闭合的候选记录。 */
    public List<ClassifiedLine> flush() {
        return candidate.isEmpty() ? List.of() : release();
    }

    /**
     * 候选记录的最后一行早于空闲窗口时释放它。
     *
     * @return 被释放的行；候选记录为空或仍在窗口内时为空列表。
     */
    List<ClassifiedLine> releaseIfIdle(long nowNanos) {
        if (candidate.isEmpty() || nowNanos - lastLineNanos < idleNanos) {
            return List.of();
        }
        log.debug("候选记录空闲超过 {} ms 仍未闭合，按响应内容处理", idleNanos / 1_000_000);
        return release();
    }

    /** 是否正在缓冲一个尚未闭合的候选记录。 */
    public boolean isAccumulating() {
        return !candidate.isEmpty();
    }

    private static boolean startsCandidate(String line) {
        return line.stripLeading().startsWith("{");
    }

    /** 这一行单独就能解析为一个被识别的事件。 */
    private boolean isStandaloneEvent(String line) {
        if (!startsCandidate(line) || depthDelta(line) != 0) {
            return false;
        }
        try {
            return eventTypeOf(objectMapper.readTree(line)) != null;
        } catch (JsonProcessingException e) {
            return false;
        }
    }

    private String eventTypeOf(JsonNode node) {
        if (node instanceof ObjectNode object) {
            JsonNode type = object.get(discriminator);
            if (type != null && type.isTextual() && eventTypes.contains(type.asText())) {
                return type.asText();
            }
        }
        return null;
    }

    private List<ClassifiedLine> evaluate() {
        String text = String.join("\n", candidate);
        try {
            JsonNode node = objectMapper.readTree(text);
            String type = eventTypeOf(node);
            if (type != null) {
                candidate.clear();
                return List.of(ClassifiedLine.event(text, (ObjectNode) node, type));
            }
        } catch (JsonProcessingException e) {
            log.trace("候选记录不是合法的 JSON: {}", e.getOriginalMessage());
        }
        return release();
    }

    private List<ClassifiedLine> release() {
        List<ClassifiedLine> lines = new ArrayList<>(candidate.size());
        for (String line : candidate) {
            lines.add(ClassifiedLine.response(line));
        }
        candidate.clear();
        return lines;
    }

    /**
     * 计算一行对括号深度的影响。JSON 字符串不会跨行，所以字符串状态按行重置。
     */
    static int depthDelta(String line) {
        int delta = 0;
        boolean inString = false;
        boolean escaped = false;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (inString) {
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == '"') {
                    inString = false;
                }
                continue;
            }
            switch (c) {
                case '"' -> inString = true;
                case '{', '[' -> delta++;
                case '}', ']' -> delta--;
                default -> {}
            }
        }
        return delta;
    }
}
