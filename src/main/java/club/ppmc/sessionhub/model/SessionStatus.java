/**
 * SessionStatus.java
 *
 * 会话记录的生命周期状态。
 * 合法的流转只有 pending → running → {completed, failed, killed}；终态不可再变，
 * 唯一的例外是恢复流程在确认 tmux 会话仍然存活时把 failed 改回 running（竞态修正）。
 * 同时带有 Jackson 与 Gson 的序列化名，以便记录文件和 WebSocket 消息都使用小写值。
 */
package club.ppmc.sessionhub.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.gson.annotations.SerializedName;

public enum SessionStatus {
    @JsonProperty("pending")
    @SerializedName("pending")
    PENDING,

    @JsonProperty("running")
    @SerializedName("running")
    RUNNING,

    @JsonProperty("completed")
    @SerializedName("completed")
    COMPLETED,

    @JsonProperty("failed")
    @SerializedName("failed")
    FAILED,

    @JsonProperty("killed")
    @SerializedName("killed")
    KILLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == KILLED;
    }

    public boolean isActive() {
        return this == PENDING || this == RUNNING;
    }

    /**
     * 判断从当前状态到目标状态的流转是否合法。
     * failed → running 只允许恢复流程使用，因此这里单独用 {@code recovering} 开关控制。
     */
    public boolean canTransitionTo(SessionStatus target, boolean recovering) {
        return switch (this) {
            case PENDING -> target != PENDING;
            case RUNNING -> target.isTerminal();
            case FAILED -> recovering && target == RUNNING;
            case COMPLETED, KILLED -> false;
        };
    }

    /** 小写的线上表示，与序列化名保持一致。 */
    public String wireName() {
        return name().toLowerCase();
    }
}
