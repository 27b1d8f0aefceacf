/**
 * EventRecord.java
 *
 * meshcli 主动发出的一条异步事件 (例如 ADVERT)。
 * 由 OutputMultiplexer 在分类出事件时创建，之后不再修改。
 */
package club.ppmc.meshbridge.model;

import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.Instant;

/**
 * @param type 判别字段的取值，例如 "ADVERT"。
 * @param payload meshcli 输出的原始 JSON 对象。桥接服务不解释其内容。
 * @param receivedAt 桥接服务收到该事件的时间。不使用 payload 中自带的时间。
 */
public record EventRecord(String type, ObjectNode payload, Instant receivedAt) {

    /** 接收时刻的 Unix 秒 (带小数)。事件日志和 WebSocket 推送中的 "ts" 都取这个值。 */
    public double receivedAtEpochSeconds() {
        return receivedAt.getEpochSecond() + receivedAt.getNano() / 1_000_000_000.0;
    }
}
