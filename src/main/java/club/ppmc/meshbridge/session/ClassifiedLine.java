/**
 * ClassifiedLine.java
 *
 * OutputClassifier 的一条分类结果。
 */
package club.ppmc.meshbridge.session;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * @param kind 事件或响应内容。
 * @param text 原始文本。事件可能跨多个物理行，此时为以换行符连接的整段文本。
 * @param payload 事件解析后的 JSON 对象；响应内容为 null。
 * @param eventType 事件判别字段的取值；响应内容为 null。
 */
public record ClassifiedLine(Kind kind, String text, ObjectNode payload, String eventType) {

    public enum Kind {
        EVENT,
        RESPONSE
    }

    static ClassifiedLine event(String text, ObjectNode payload, String eventType) {
        return new ClassifiedLine(Kind.EVENT, text, payload, eventType);
    }

    static ClassifiedLine response(String text) {
        return new ClassifiedLine(Kind.RESPONSE, text, null, null);
    }

    public boolean isEvent() {
        return kind == Kind.EVENT;
    }
}
