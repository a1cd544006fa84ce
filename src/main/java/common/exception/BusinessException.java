package common.exception;

/**
 * 业务异常
 * 请求级别的错误 (实体不存在、状态不允许、位置冲突等), 由 GlobalExceptionHandler 统一转换为响应
 */
public class BusinessException extends RuntimeException {

    public BusinessException(String message) {
        super(message);
    }

    public BusinessException(String message, Throwable cause) {
        super(message, cause);
    }
}
