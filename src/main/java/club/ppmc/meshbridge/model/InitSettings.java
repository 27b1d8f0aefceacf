/**
 * InitSettings.java
 *
 * Web 应用写入 .webui_settings.json 的会话初始化开关。
 * 桥接服务只读取，不写入；每次会话启动时读取一次。
 */
package club.ppmc.meshbridge.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class InitSettings {

    /**
     * 是否需要手动批准新联系人。开启时会话初始化会额外发送 "set manual_add_contacts on"。
     */
    @JsonProperty("manual_add_contacts")
    private boolean manualAddContacts = false;
}
