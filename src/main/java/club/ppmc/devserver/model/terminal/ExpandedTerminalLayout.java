/**
 * ExpandedTerminalLayout.java
 *
 * getTerminalLayoutInfo 的返回值：存储的终端引用被展开为实时的终端描述。
 * 无法解析的终端会被移除，展开后为空的标签页也会被移除。
 */
package club.ppmc.devserver.model.terminal;

import java.util.List;

public record ExpandedTerminalLayout(List<Tab> tabs) {

    public record Tab(boolean active, Integer activePersistentTerminalId, List<Instance> terminals) {}

    /**
     * @param terminal 终端描述；进程已断开时为 null（随后会被过滤掉）。
     * @param relativeSize 相对尺寸。
     */
    public record Instance(TerminalDescription terminal, Double relativeSize) {}
}
