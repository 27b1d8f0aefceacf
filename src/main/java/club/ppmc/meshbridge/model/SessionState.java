/**
 * SessionState.java
 *
 * meshcli 会话的生命周期状态。
 * 正常路径为 STARTING → RUNNING；进程意外退出时经 CRASHED → RESTARTING 回到 STARTING；
 * 服务关闭时进入终态 STOPPED。
 */
package club.ppmc.meshbridge.model;

public enum SessionState {
    STARTING,
    RUNNING,
    CRASHED,
    RESTARTING,
    STOPPED
}
