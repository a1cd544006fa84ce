package controller;

import common.Result;
import common.consts.PlanErrorEnum;
import model.dto.request.PlacementReq;
import model.dto.response.PlacementResp;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import service.PlacementService;

/**
 * 装载接口
 */
@RestController
@RequestMapping("/api/placement")
public class PlacementController {

    private final PlacementService placementService;

    public PlacementController(PlacementService placementService) {
        this.placementService = placementService;
    }

    /**
     * 批量放置货物; 部分货物放不下时返回 206 及已放置的结果
     */
    @PostMapping
    public Result place(@RequestBody PlacementReq req) {
        PlacementResp resp = placementService.placeItems(req);
        if (resp.isSuccess()) {
            return Result.success("装载成功", resp);
        }
        if (PlanErrorEnum.PERSISTENCE_FAILURE.getCode().equals(resp.getErrorCode())) {
            return Result.error(500, resp.getError(), resp);
        }
        return Result.partial(resp.getError(), resp);
    }

    @GetMapping("/all")
    public Result listAll() {
        return Result.success("查询成功", placementService.listPlacements());
    }
}
