/**
 * CommandResult.java
 *
 * 一条命令的最终结果，也是 POST /cli 的响应体。
 * 字段沿用 subprocess 风格 (stdout / stderr / returncode)，这样调用方无需关心命令是经由持久会话执行的。
 */
package club.ppmc.meshbridge.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * @param success 命令是否在静默阈值内正常结束。
 * @param stdout 该命令收集到的全部响应行，以换行符连接。
 * @param stderr 失败原因的文字描述；成功时为空字符串。
 * @param returncode 成功为 0，失败为 -1。
 * @param reason 失败原因分类；成功时为 null，不会被序列化。
 */
public record CommandResult(
        boolean success,
        String stdout,
        String stderr,
        int returncode,
        @JsonInclude(JsonInclude.Include.NON_NULL) FailureReason reason) {

    public static CommandResult success(String stdout) {
        return new CommandResult(true, stdout, "", 0, null);
    }

    public static CommandResult failure(FailureReason reason, String message) {
        return new CommandResult(false, "", message, -1, reason);
    }

    /** 请求本身不合法时使用，此时没有对应的失败分类。 */
    public static CommandResult rejected(String message) {
        return new CommandResult(false, "", message, -1, null);
    }
}
