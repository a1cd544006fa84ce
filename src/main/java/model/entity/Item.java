package model.entity;

import common.consts.ItemStatusEnum;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * 货物实体
 */
@Data
@NoArgsConstructor
public class Item {
    private String itemId;        // 货物ID (唯一)
    private String name;          // 名称

    // 原始尺寸 (cm), 放置时可任意旋转
    private Double width;
    private Double depth;
    private Double height;

    private Double mass;          // 质量 (kg)
    private Integer priority;     // 优先级 0-100, 越大越重要

    private LocalDate expiryDate; // 有效期, 为空表示不过期
    private Integer usageLimit;   // 使用次数上限, 为空表示不限
    private int currentUses;      // 已使用次数

    private String preferredZone; // 偏好区域, 为空表示不限

    private ItemStatusEnum status = ItemStatusEnum.ACTIVE;

    public boolean isActive() {
        return status == ItemStatusEnum.ACTIVE;
    }

    /**
     * 剩余使用次数, 不限次数时返回 null
     */
    public Integer remainingUses() {
        if (usageLimit == null) return null;
        return Math.max(usageLimit - currentUses, 0);
    }
}
