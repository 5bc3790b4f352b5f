/**
 * PermissionProfile.java
 *
 * 决定为一个会话启动什么样的进程。
 * interactive: 交互式 Agent；auto: 非交互的一次性执行，输出机器可读格式；
 * yolo: 完全自主，跳过所有确认；plain: 不启动 Agent，只开一个交互式 shell。
 */
package club.ppmc.sessionhub.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.gson.annotations.SerializedName;

public enum PermissionProfile {
    @JsonProperty("interactive")
    @SerializedName("interactive")
    INTERACTIVE,

    @JsonProperty("auto")
    @SerializedName("auto")
    AUTO,

    @JsonProperty("yolo")
    @SerializedName("yolo")
    YOLO,

    @JsonProperty("plain")
    @SerializedName("plain")
    PLAIN
}
