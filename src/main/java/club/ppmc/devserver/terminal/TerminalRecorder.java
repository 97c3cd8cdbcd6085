/**
 * TerminalRecorder.java
 *
 * 记录终端输出和尺寸变化，以便在客户端（重新）附加时原样回放。
 * 记录器始终在捕获，无论当前是否有客户端附加。
 *
 * <p>容量有上限：当记录的数据总字符数超过 maxChars 时，从最旧的条目开始丢弃。
 * 被丢弃的 resize 条目成为新的起始尺寸；单个超大的数据块只保留其尾部。
 * 连续的 resize（中间没有数据）会被合并为最后一次。
 */
package club.ppmc.devserver.terminal;

import club.ppmc.devserver.model.terminal.ReplayEntry;
import club.ppmc.devserver.model.terminal.ReplayEvent;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

public class TerminalRecorder {

    private final int maxChars;
    private final Deque<ReplayEntry> entries = new ArrayDeque<>();
    private int startCols;
    private int startRows;
    private long dataLength;

    public TerminalRecorder(int cols, int rows, int maxChars) {
        if (maxChars <= 0) {
            throw new IllegalArgumentException("maxChars must be positive: " + maxChars);
        }
        this.startCols = cols;
        this.startRows = rows;
        this.maxChars = maxChars;
    }

    public synchronized void recordResize(int cols, int rows) {
        ReplayEntry last = entries.peekLast();
        if (last != null && !last.isData()) {
            entries.pollLast();
        }
        if (entries.isEmpty()) {
            // 缓冲区开头没有数据时，尺寸变化直接改写起始尺寸
            startCols = cols;
            startRows = rows;
            return;
        }
        entries.addLast(ReplayEntry.resize(cols, rows));
    }

    public synchronized void recordData(String data) {
        if (data == null || data.isEmpty()) {
            return;
        }
        if (data.length() > maxChars) {
            data = data.substring(data.length() - maxChars);
        }
        entries.addLast(ReplayEntry.data(data));
        dataLength += data.length();
        evict();
    }

    /**
     * 生成回放事件：先是起始尺寸，然后是按顺序记录的全部事件。
     *
     * @return 一个新的、不可变的回放事件。
     */
    public synchronized ReplayEvent generateReplayEvent() {
        List<ReplayEntry> events = new ArrayList<>(entries.size() + 1);
        events.add(ReplayEntry.resize(startCols, startRows));
        events.addAll(entries);
        return new ReplayEvent(startCols, startRows, List.copyOf(events));
    }

    public synchronized long getDataLength() {
        return dataLength;
    }

    private void evict() {
        while (dataLength > maxChars && entries.size() > 1) {
            ReplayEntry dropped = entries.pollFirst();
            if (dropped.isData()) {
                dataLength -= dropped.data().length();
            } else {
                startCols = dropped.cols();
                startRows = dropped.rows();
            }
        }
        // 丢弃到开头只剩 resize 时，把它折叠进起始尺寸
        while (!entries.isEmpty() && !entries.peekFirst().isData()) {
            ReplayEntry resize = entries.pollFirst();
            startCols = resize.cols();
            startRows = resize.rows();
        }
    }
}
