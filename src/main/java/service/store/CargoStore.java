package service.store;

import engine.Layout;
import engine.PlacementPlan;
import model.entity.Container;
import model.entity.Item;

import java.util.List;

/**
 * 货物存储接口
 * 规划引擎只读取快照并返回差量, 由存储整体提交
 */
public interface CargoStore {

    /**
     * 读取指定储物箱的当前布局 (只包含可用状态的货物)
     */
    Layout loadLayout(List<Container> containers);

    /**
     * 整体提交一次装载规划: 储物箱定义、新货物、放置变更
     * 任何一项校验不通过都不会修改数据
     *
     * @throws common.exception.PersistenceException 提交失败
     */
    void applyPlan(List<Container> containers, List<Item> submittedItems, PlacementPlan plan);

    /**
     * 存储中的全部储物箱, 按ID排序
     */
    List<Container> listContainers();
}
