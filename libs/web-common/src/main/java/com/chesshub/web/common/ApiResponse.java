package com.chesshub.web.common;

import java.io.Serializable;

/**
 * 统一 HTTP 响应外壳
 * <p>
 * code 与 HTTP 状态码保持一致（200/400/403/404/409/500），
 * 出错时 data 为 null，message 为面向客户端的错误说明。
 *
 * @param <T> 响应数据类型
 */
public record ApiResponse<T>(int code, String message, T data) implements Serializable {

    public static <T> ApiResponse<T> success(T data) {
        return new ApiResponse<>(200, "success", data);
    }

    public static <T> ApiResponse<T> error(int code, String message) {
        return new ApiResponse<>(code, message, null);
    }

    /** 400：参数不合法 / 业务前置条件不满足 */
    public static <T> ApiResponse<T> badRequest(String message) {
        return error(400, message);
    }

    /** 403：调用方不是该对局的玩家 */
    public static <T> ApiResponse<T> forbidden(String message) {
        return error(403, message);
    }

    /** 404：对局不存在 */
    public static <T> ApiResponse<T> notFound(String message) {
        return error(404, message);
    }

    /** 409：状态冲突（已满员、已开始、已结束） */
    public static <T> ApiResponse<T> conflict(String message) {
        return error(409, message);
    }

    public static <T> ApiResponse<T> serverError(String message) {
        return error(500, message);
    }
}
