package model.dto.request;

import lombok.Data;

import java.time.LocalDate;

/**
 * 废弃物回收计划请求
 */
@Data
public class WasteReturnPlanReq {
    private String undockingContainerId; // 离港舱
    private LocalDate undockingDate;     // 离港日期
    private Double maxWeight;            // 离港舱载重上限 (kg)
    private String userId;
}
