/**
 * ReplayEntry.java
 *
 * 回放事件序列中的单个条目：要么是一段输出数据，要么是一次终端尺寸变化。
 * 未使用的字段为 null，Gson 序列化时会自动省略。
 */
package club.ppmc.devserver.model.terminal;

public record ReplayEntry(String type, String data, Integer cols, Integer rows) {

    public static final String TYPE_DATA = "data";
    public static final String TYPE_RESIZE = "resize";

    public static ReplayEntry data(String data) {
        return new ReplayEntry(TYPE_DATA, data, null, null);
    }

    public static ReplayEntry resize(int cols, int rows) {
        return new ReplayEntry(TYPE_RESIZE, null, cols, rows);
    }

    public boolean isData() {
        return TYPE_DATA.equals(type);
    }
}
