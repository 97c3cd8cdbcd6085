/**
 * TerminalChannelMessage.java
 *
 * 服务器通过管理连接发给客户端的终端消息：
 * 回复 {type:"reply", requestId, result}、错误 {type:"error", requestId, message}
 * 或事件 {type:"event", event, id, payload}。为 null 的字段不会被 Gson 输出。
 */
package club.ppmc.devserver.model.terminal;

public record TerminalChannelMessage(
        String type, Integer requestId, Object result, String message, String event, Integer id, Object payload) {

    public static TerminalChannelMessage reply(Integer requestId, Object result) {
        return new TerminalChannelMessage("reply", requestId, result, null, null, null, null);
    }

    public static TerminalChannelMessage error(Integer requestId, String message) {
        return new TerminalChannelMessage("error", requestId, null, message, null, null, null);
    }

    public static TerminalChannelMessage event(String event, int id, Object payload) {
        return new TerminalChannelMessage("event", null, null, null, event, id, payload);
    }
}
