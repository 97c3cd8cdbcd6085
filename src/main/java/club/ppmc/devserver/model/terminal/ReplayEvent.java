/**
 * ReplayEvent.java
 *
 * 一次完整回放的载荷：缓冲区起始时的终端尺寸，以及按原始顺序排列的数据与尺寸事件。
 * 事件列表总是以起始尺寸的 resize 条目开头，客户端按顺序应用即可重建可见状态。
 */
package club.ppmc.devserver.model.terminal;

import java.util.List;

public record ReplayEvent(int cols, int rows, List<ReplayEntry> events) {

    /** 回放中所有数据条目的字符总数。 */
    public int dataLength() {
        return events.stream().filter(ReplayEntry::isData).mapToInt(e -> e.data().length()).sum();
    }

    public long resizeCount() {
        return events.stream().filter(e -> !e.isData()).count();
    }
}
