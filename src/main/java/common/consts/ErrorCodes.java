package common.consts;

/**
 * 全局错误信息常量池
 */
public class ErrorCodes {
    // 基础错误
    public static final String SYSTEM_ERROR = "系统内部错误";

    // 实体不存在
    public static final String ITEM_NOT_FOUND = "指定的货物不存在";
    public static final String CONTAINER_NOT_FOUND = "指定的储物箱不存在";

    // 状态错误
    public static final String ITEM_NOT_ACTIVE = "货物不是可用状态, 无法执行该操作";
    public static final String USAGE_LIMIT_EXCEEDED = "货物使用次数已达上限";

    // 参数错误
    public static final String INVALID_DIMENSION = "尺寸必须大于0";
    public static final String INVALID_MASS = "质量必须大于0";
    public static final String INVALID_PRIORITY = "优先级必须在 0-100 之间";
    public static final String INVALID_USAGE_LIMIT = "使用次数上限不能为负数";
    public static final String INVALID_BOX = "坐标非法, 终点必须在每个轴上大于起点且起点不小于0";
    public static final String DUPLICATE_ITEM = "同一请求中货物ID重复";
    public static final String DUPLICATE_CONTAINER = "同一请求中储物箱ID重复";
    public static final String MISSING_ITEM_ID = "货物ID不能为空";
    public static final String MISSING_QUERY = "必须提供 itemId 或 itemName";
    public static final String INVALID_MAX_WEIGHT = "最大重量必须大于0";

    // 空间约束
    public static final String OUT_OF_BOUNDS = "目标位置超出储物箱边界";
    public static final String POSITION_OVERLAP = "目标位置与已放置的货物重叠";
    public static final String POSITION_UNSUPPORTED = "目标位置悬空, 底部没有支撑";
}
