/**
 * TerminalRequest.java
 *
 * 管理连接上的一条终端 RPC 请求：{requestId, command, args}。
 * args 的结构由 command 决定，因此保留为原始 JsonObject，由 TerminalChannelService 按命令解析。
 */
package club.ppmc.devserver.model.terminal;

import com.google.gson.JsonObject;
import lombok.Data;

@Data
public class TerminalRequest {

    private Integer requestId;
    private String command;
    private JsonObject args;
}
