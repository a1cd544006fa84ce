package controller;

import common.Result;
import model.dto.request.UndockingCompleteReq;
import model.dto.request.WasteReturnPlanReq;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import service.WasteService;

import java.time.LocalDate;
import java.util.Map;

/**
 * 废弃物管理接口
 */
@RestController
@RequestMapping("/api/waste")
public class WasteController {

    private final WasteService wasteService;

    public WasteController(WasteService wasteService) {
        this.wasteService = wasteService;
    }

    /**
     * 识别废弃物; asOf 为判定过期的日期, 不传取当天
     */
    @GetMapping("/identify")
    public Result identify(@RequestParam(required = false)
                           @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate asOf) {
        return Result.success("查询成功", wasteService.identify(asOf));
    }

    @PostMapping("/return-plan")
    public Result returnPlan(@RequestBody WasteReturnPlanReq req) {
        return Result.success("回收计划生成成功", wasteService.returnPlan(req));
    }

    @PostMapping("/complete-undocking")
    public Result completeUndocking(@RequestBody UndockingCompleteReq req) {
        int removed = wasteService.completeUndocking(req);
        return Result.success("离港完成", Map.of("itemsRemoved", removed));
    }
}
