package controller;

import common.Result;
import model.dto.request.PlaceReq;
import model.dto.request.RetrieveReq;
import model.dto.response.PlacementDto;
import model.dto.response.SearchResp;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import service.RetrievalService;

/**
 * 货物查找与取用接口
 */
@RestController
@RequestMapping("/api")
public class RetrievalController {

    private final RetrievalService retrievalService;

    public RetrievalController(RetrievalService retrievalService) {
        this.retrievalService = retrievalService;
    }

    /**
     * 按ID或名称查找货物, 同时返回取货步骤
     */
    @GetMapping("/search")
    public Result search(@RequestParam(required = false) String itemId,
                         @RequestParam(required = false) String itemName) {
        SearchResp resp = retrievalService.search(itemId, itemName);
        return Result.success(resp.isFound() ? "查询成功" : "未找到可用货物", resp);
    }

    @PostMapping("/retrieve")
    public Result retrieve(@RequestBody RetrieveReq req) {
        return Result.success("取用成功", retrievalService.retrieve(req));
    }

    @PostMapping("/place")
    public Result place(@RequestBody PlaceReq req) {
        return Result.success("放置成功", PlacementDto.from(retrievalService.place(req)));
    }
}
