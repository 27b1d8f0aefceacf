/**
 * BridgeEvent.java
 *
 * 所有通过WebSocket推送的消息的统一包装。
 * 这种包装器模式使得前端可以根据 'type' 字段来分发和处理不同类型的消息。
 */
package club.ppmc.meshbridge.model;

/**
 * @param type 消息类型，"EVENT" 或 "SESSION_STATE"。
 * @param data 消息负载，其类型取决于 `type`。
 * @param <T> 负载的泛型类型。
 */
public record BridgeEvent<T>(String type, T data) {}
