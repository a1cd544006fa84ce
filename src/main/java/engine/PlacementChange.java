package engine;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;
import model.entity.Box;

/**
 * 规划结果中的一条放置变更 (新建或移动), 提交时按 upsert 处理
 */
@Getter
@ToString
@AllArgsConstructor
public class PlacementChange {
    private final String itemId;
    private final String containerId;
    private final Box box;
}
