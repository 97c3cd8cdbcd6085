/**
 * TerminalDescription.java
 *
 * 面向客户端的持久化终端描述，用于布局展开和终端列表。
 */
package club.ppmc.devserver.model.terminal;

public record TerminalDescription(
        int id,
        String title,
        long pid,
        String workspaceId,
        String workspaceName,
        String cwd,
        boolean orphan) {}
