package controller;

import common.Result;
import common.consts.LogActionTypeEnum;
import common.exception.BusinessException;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import service.log.ActionLogService;

import java.time.LocalDateTime;

/**
 * 操作日志查询接口
 */
@RestController
@RequestMapping("/api/logs")
public class LogController {

    private final ActionLogService actionLog;

    public LogController(ActionLogService actionLog) {
        this.actionLog = actionLog;
    }

    /**
     * 条件查询, 不传的条件不过滤
     */
    @GetMapping
    public Result query(@RequestParam(required = false) String itemId,
                        @RequestParam(required = false) String userId,
                        @RequestParam(required = false) String actionType,
                        @RequestParam(required = false)
                        @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime from,
                        @RequestParam(required = false)
                        @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime to) {
        LogActionTypeEnum type = null;
        if (actionType != null && !actionType.isBlank()) {
            type = LogActionTypeEnum.getByCode(actionType);
            if (type == null) {
                throw new BusinessException("未知的操作类型: " + actionType);
            }
        }
        return Result.success("查询成功", actionLog.query(itemId, userId, type, from, to));
    }
}
