package model.bo;

import lombok.Getter;
import model.entity.Container;
import model.entity.Item;
import model.entity.Placement;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 舱内货物数据的全局上下文 (内存存储)
 * 写操作由服务层在 synchronized (CargoContext) 内完成: 规划与提交共用一把锁。
 */
@Getter
public class CargoContext {

    private static volatile CargoContext instance;

    // 所有货物 (含已废弃、已处置的)
    private final Map<String, Item> itemMap = new ConcurrentHashMap<>();
    // 所有储物箱
    private final Map<String, Container> containerMap = new ConcurrentHashMap<>();
    // 当前放置, 货物ID -> 放置 (一件货物最多一个放置)
    private final Map<String, Placement> placementMap = new ConcurrentHashMap<>();
    // 已纳入回收计划的货物, 货物ID -> 离港舱ID
    private final Map<String, String> disposalPlanMap = new ConcurrentHashMap<>();

    // 防止外部直接 new 对象
    private CargoContext() {}

    /**
     * 获取全局上下文单例
     */
    public static CargoContext getInstance() {
        if (instance == null) {
            synchronized (CargoContext.class) {
                if (instance == null) {
                    instance = new CargoContext();
                }
            }
        }
        return instance;
    }

    /**
     * 场景重置
     */
    public void clearAll() {
        itemMap.clear();
        containerMap.clear();
        placementMap.clear();
        disposalPlanMap.clear();
    }
}
