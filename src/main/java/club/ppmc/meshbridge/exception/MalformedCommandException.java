/**
 * MalformedCommandException.java
 *
 * 调用方提交的命令无法安全地序列化为 meshcli 的一行输入 (例如参数中包含换行符)。
 * 在入队之前同步抛出，Controller 将其转换为 400 响应。
 */
package club.ppmc.meshbridge.exception;

import java.util.Map;
import lombok.Getter;

@Getter
public class MalformedCommandException extends RuntimeException {

    /** 出问题的参数下标；与具体参数无关时为 -1。 */
    private final int argumentIndex;

    public MalformedCommandException(String message, int argumentIndex) {
        super(message);
        this.argumentIndex = argumentIndex;
    }

    public Map<String, Object> toErrorData() {
        return Map.of(
                "type", "MALFORMED_COMMAND",
                "message", getMessage(),
                "argumentIndex", argumentIndex);
    }
}
