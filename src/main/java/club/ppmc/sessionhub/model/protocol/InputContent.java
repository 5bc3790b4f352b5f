/**
 * InputContent.java
 *
 * 有序输入消息的内容：写入数据、调整终端尺寸或终止会话。
 */
package club.ppmc.sessionhub.model.protocol;

public record InputContent(String kind, String data, Integer cols, Integer rows) {

    public static final String KIND_INPUT = "input";
    public static final String KIND_RESIZE = "resize";
    public static final String KIND_KILL = "kill";

    public boolean isWrite() {
        return KIND_INPUT.equals(kind) && data != null && !data.isEmpty();
    }

    public boolean isResize() {
        return KIND_RESIZE.equals(kind) && cols != null && rows != null && cols > 0 && rows > 0;
    }

    public boolean isKill() {
        return KIND_KILL.equals(kind);
    }
}
