/**
 * ExtensionHostAck.java
 *
 * 扩展宿主连接的握手确认帧。debugPort 为 null 时 Gson 不会输出该字段。
 */
package club.ppmc.devserver.model;

public record ExtensionHostAck(Integer debugPort) {}
