package common.exception;

import common.Result;
import common.consts.ErrorCodes;
import common.consts.PlanErrorEnum;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * 全局异常处理器
 * 捕获所有异常，记录日志，并转换为统一的响应结构
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    /**
     * 处理业务异常
     */
    @ExceptionHandler(BusinessException.class)
    public Result handleBusinessException(BusinessException e) {
        log.warn("业务异常: {}", e.getMessage());
        return Result.error(400, e.getMessage());
    }

    /**
     * 处理提交失败 (整批回滚, 数据未改动)
     */
    @ExceptionHandler(PersistenceException.class)
    public Result handlePersistenceException(PersistenceException e) {
        log.error("提交失败: {} {}", e.getMessage(), e.getViolations());
        return Result.error(500, PlanErrorEnum.PERSISTENCE_FAILURE.getDesc() + ": " + e.getMessage(),
                e.getViolations());
    }

    /**
     * 处理所有其他异常
     */
    @ExceptionHandler(Exception.class)
    public Result handleException(Exception e) {
        log.error("系统异常", e);
        return Result.error(ErrorCodes.SYSTEM_ERROR + ": " + e.getMessage());
    }
}
