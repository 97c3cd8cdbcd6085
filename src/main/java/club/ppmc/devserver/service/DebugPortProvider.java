/**
 * DebugPortProvider.java
 *
 * 为扩展宿主连接的握手确认提供调试端口。
 */
package club.ppmc.devserver.service;

public interface DebugPortProvider {

    /**
     * @return 扩展宿主的调试端口；未启用调试时为 null，确认帧中将不包含该字段。
     */
    Integer getDebugPort();
}
