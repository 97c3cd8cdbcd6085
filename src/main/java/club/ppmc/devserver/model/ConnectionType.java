/**
 * ConnectionType.java
 *
 * 客户端在握手消息中请求的逻辑通道类型。
 * Management 与 ExtensionHost 会生成可重连的 Connection 对象；Tunnel 则直接把套接字交给隧道服务。
 */
package club.ppmc.devserver.model;

import com.google.gson.annotations.SerializedName;

public enum ConnectionType {
    @SerializedName("Management")
    MANAGEMENT,

    @SerializedName("ExtensionHost")
    EXTENSION_HOST,

    @SerializedName("Tunnel")
    TUNNEL
}
