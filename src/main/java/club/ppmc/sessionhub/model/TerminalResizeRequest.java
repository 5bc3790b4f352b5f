/**
 * TerminalResizeRequest.java
 *
 * 调整终端尺寸的请求体。
 */
package club.ppmc.sessionhub.model;

import jakarta.validation.constraints.Min;

public record TerminalResizeRequest(@Min(1) int cols, @Min(1) int rows) {}
