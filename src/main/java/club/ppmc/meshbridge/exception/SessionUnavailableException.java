/**
 * SessionUnavailableException.java
 *
 * 桥接服务已关闭 (或正在关闭)，不再接受新的命令。
 * Controller 将其转换为 503 响应。
 */
package club.ppmc.meshbridge.exception;

public class SessionUnavailableException extends RuntimeException {

    public SessionUnavailableException(String message) {
        super(message);
    }
}
