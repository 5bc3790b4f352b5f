/**
 * TerminalInputRequest.java
 *
 * 向会话写入原始输入的请求体。
 */
package club.ppmc.sessionhub.model;

import jakarta.validation.constraints.NotNull;

public record TerminalInputRequest(@NotNull String data) {}
