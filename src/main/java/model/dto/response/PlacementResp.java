package model.dto.response;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 装载响应
 * success 仅在所有提交的货物都已放置时为 true; 部分成功时已放置的结果照常返回
 */
@Data
public class PlacementResp {
    private boolean success;
    private List<PlacementDto> placements = new ArrayList<>();
    private List<RearrangementStepDto> rearrangements = new ArrayList<>();
    private List<String> failedItemIds = new ArrayList<>();
    private List<ItemIssueDto> rejectedItems = new ArrayList<>();
    private String error;
    private String errorCode; // 整批失败时的错误分类, 见 PlanErrorEnum
}
