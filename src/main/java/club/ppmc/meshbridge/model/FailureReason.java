/**
 * FailureReason.java
 *
 * 命令失败原因的分类。
 * 命令级别的失败只返回给发起该命令的调用方；SESSION_CRASHED 和 SHUTDOWN 会广播给所有待处理的调用方。
 */
package club.ppmc.meshbridge.model;

public enum FailureReason {
    /** 在调用方的超时时间内没有等到输出静默。 */
    TIMEOUT,
    /** meshcli 进程在命令排队或执行期间退出。 */
    SESSION_CRASHED,
    /** 写入 meshcli 标准输入失败。 */
    WRITE_FAILED,
    /** 桥接服务正在关闭。 */
    SHUTDOWN
}
