/**
 * SessionEventListener.java
 *
 * 接收 meshcli 异步事件和会话状态变化的回调。
 * 实现必须尽快返回；抛出的异常会被记录并忽略，不会影响命令执行。
 */
package club.ppmc.meshbridge.session;

import club.ppmc.meshbridge.model.EventRecord;
import club.ppmc.meshbridge.model.SessionState;

public interface SessionEventListener {

    void onEvent(EventRecord event);

    default void onStateChange(long generation, SessionState state) {}
}
