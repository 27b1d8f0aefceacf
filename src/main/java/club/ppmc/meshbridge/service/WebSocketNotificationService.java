/**
 * WebSocketNotificationService.java
 *
 * 统一的WebSocket消息发送服务。
 * 把 meshcli 的异步事件广播到 /topic/events，把会话状态变化广播到 /topic/session/status。
 * 推送是尽力而为的，失败只记录日志。
 */
package club.ppmc.meshbridge.service;

import club.ppmc.meshbridge.model.BridgeEvent;
import club.ppmc.meshbridge.model.EventRecord;
import club.ppmc.meshbridge.model.SessionState;
import club.ppmc.meshbridge.session.SessionEventListener;
import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.MessagingException;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Service;

@Service
@Slf4j
public class WebSocketNotificationService implements SessionEventListener {

    static final String EVENTS_TOPIC = "/topic/events";
    static final String STATUS_TOPIC = "/topic/session/status";

    private final SimpMessagingTemplate messagingTemplate;
    private final Gson gson;

    public WebSocketNotificationService(SimpMessagingTemplate messagingTemplate, Gson gson) {
        this.messagingTemplate = messagingTemplate;
        this.gson = gson;
    }

    @Override
    public void onEvent(EventRecord event) {
        JsonElement payload = JsonParser.parseString(event.payload().toString());
        if (payload.isJsonObject()) {
            payload.getAsJsonObject().addProperty("ts", event.receivedAtEpochSeconds());
        }
        sendMessage(EVENTS_TOPIC, gson.toJson(new BridgeEvent<>("EVENT", payload)));
    }

    @Override
    public void onStateChange(long generation, SessionState state) {
        var data = new JsonObject();
        data.addProperty("generation", generation);
        data.addProperty("state", state.name());
        sendMessage(STATUS_TOPIC, gson.toJson(new BridgeEvent<>("SESSION_STATE", data)));
    }

    /**
     * 向指定的WebSocket主题发送一个载荷 (payload)。
     */
    public void sendMessage(String destination, Object payload) {
        try {
            messagingTemplate.convertAndSend(destination, payload);
        } catch (MessagingException e) {
            log.warn("向 {} 推送消息失败: {}", destination, e.getMessage());
        }
    }
}
