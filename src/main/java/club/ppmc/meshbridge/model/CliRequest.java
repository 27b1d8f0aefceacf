/**
 * CliRequest.java
 *
 * POST /cli 的请求体。
 */
package club.ppmc.meshbridge.model;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.util.List;

/**
 * @param args meshcli 命令及其参数，例如 ["recv"] 或 ["msg", "Alice", "hello there"]。
 * @param timeout (可选) 超时秒数。未指定时使用默认值，"recv" 命令使用更长的默认值。
 */
public record CliRequest(
        @NotEmpty(message = "Missing required field: args") List<@NotNull String> args,
        @Positive Integer timeout) {}
