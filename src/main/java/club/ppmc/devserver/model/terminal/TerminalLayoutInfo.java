/**
 * TerminalLayoutInfo.java
 *
 * 某个工作区的终端布局：有序的标签页，每个标签页包含按顺序排列的终端引用。
 * 由客户端整体提交（setTerminalLayoutInfo），注册表按工作区 ID 整体替换保存。
 */
package club.ppmc.devserver.model.terminal;

import java.util.ArrayList;
import java.util.List;
import lombok.Data;

@Data
public class TerminalLayoutInfo {

    private String workspaceId;

    private List<Tab> tabs = new ArrayList<>();

    @Data
    public static class Tab {
        private boolean active;
        private Integer activePersistentTerminalId;
        private List<Instance> terminals = new ArrayList<>();
    }

    /** 对一个持久化终端的引用及其在标签页中的相对尺寸。 */
    @Data
    public static class Instance {
        private int terminal;
        private Double relativeSize;
    }
}
