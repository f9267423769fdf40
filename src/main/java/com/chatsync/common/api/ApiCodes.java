package com.chatsync.common.api;

/**
 * 统一错误码定义。
 *
 * <p>前两位与 HTTP 状态码对齐，方便脚本/前端只看 code 也能判断大类。</p>
 */
public final class ApiCodes {

    private ApiCodes() {
    }

    /** 参数不合法 / 业务校验失败 */
    public static final int BAD_REQUEST = 40000;

    /** 未登录 / token 无效 */
    public static final int UNAUTHORIZED = 40100;

    /** 已登录但无权操作（非发送者、非群主、非会话成员） */
    public static final int FORBIDDEN = 40300;

    /** 消息/群/用户不存在 */
    public static final int NOT_FOUND = 40400;

    /** 触发限流 */
    public static final int TOO_MANY_REQUESTS = 42900;

    /** 服务端未预期异常（含存储失败） */
    public static final int INTERNAL_ERROR = 50000;
}
