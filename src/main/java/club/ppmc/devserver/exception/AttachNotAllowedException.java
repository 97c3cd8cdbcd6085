/**
 * AttachNotAllowedException.java
 *
 * 调用方把一个"附加到已有终端"的描述符当作创建请求提交。这是调用方的编程错误。
 */
package club.ppmc.devserver.exception;

public class AttachNotAllowedException extends RuntimeException {

    public AttachNotAllowedException() {
        super("Attempt to create a process when attach object was provided");
    }
}
