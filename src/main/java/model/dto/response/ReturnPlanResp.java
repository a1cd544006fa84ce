package model.dto.response;

import engine.RetrievalStep;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * 废弃物回收计划响应
 */
@Data
public class ReturnPlanResp {
    private List<ReturnStep> returnPlan = new ArrayList<>();
    private List<RetrievalStep> retrievalSteps = new ArrayList<>();
    private Manifest returnManifest;

    /**
     * 回收搬运步骤: 取出的废弃物搬到离港舱
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ReturnStep {
        private int step;
        private String itemId;
        private String itemName;
        private String fromContainer;
        private String toContainer;
    }

    /**
     * 回收清单
     */
    @Data
    public static class Manifest {
        private String undockingContainerId;
        private LocalDate undockingDate;
        private List<ManifestItem> returnItems = new ArrayList<>();
        private double totalVolume;
        private double totalWeight;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ManifestItem {
        private String itemId;
        private String name;
        private String reason;
    }
}
