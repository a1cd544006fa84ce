package controller;

import common.Result;
import common.consts.ErrorCodes;
import common.exception.BusinessException;
import engine.PlanValidator;
import lombok.Getter;
import model.bo.CargoContext;
import model.dto.request.ScenarioLoadReq;
import model.dto.response.PlacementDto;
import model.dto.snapshot.CargoSnapshotDto;
import model.entity.Box;
import model.entity.Container;
import model.entity.Item;
import model.entity.Placement;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import service.log.ActionLogService;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 场景管理接口: 装载、重置与读取
 */
@RestController
@RequestMapping("/api/admin")
public class AdminController {

    private final ActionLogService actionLog;

    public AdminController(ActionLogService actionLog) {
        this.actionLog = actionLog;
    }

    /**
     * 清空货物、储物箱、放置与操作日志
     */
    @PostMapping("/reset")
    public Result reset() {
        synchronized (CargoContext.getInstance()) {
            CargoContext.getInstance().clearAll();
            actionLog.clear();
        }
        return Result.success("重置成功");
    }

    /**
     * 整体替换当前数据; 任一条目非法时不做任何修改
     */
    @PostMapping("/load")
    public Result load(@RequestBody ScenarioLoadReq req) {
        synchronized (CargoContext.getInstance()) {
            CargoContext ctx = CargoContext.getInstance();
            StagedData staged = validate(req);

            ctx.clearAll();
            ctx.getContainerMap().putAll(staged.getContainerMap());
            ctx.getItemMap().putAll(staged.getItemMap());
            ctx.getPlacementMap().putAll(staged.getPlacementMap());
            return Result.success("场景装载成功");
        }
    }

    @GetMapping("/state")
    public Result state() {
        synchronized (CargoContext.getInstance()) {
            CargoContext ctx = CargoContext.getInstance();
            CargoSnapshotDto snapshot = new CargoSnapshotDto();
            snapshot.setContainers(ctx.getContainerMap().values().stream()
                    .sorted(Comparator.comparing(Container::getContainerId))
                    .collect(Collectors.toList()));
            snapshot.setItems(ctx.getItemMap().values().stream()
                    .sorted(Comparator.comparing(Item::getItemId))
                    .collect(Collectors.toList()));
            snapshot.setPlacements(ctx.getPlacementMap().values().stream()
                    .map(PlacementDto::from)
                    .sorted(Comparator.comparing(PlacementDto::getItemId))
                    .collect(Collectors.toList()));
            return Result.success("查询成功", snapshot);
        }
    }

    /**
     * 先在临时容器中整理请求数据, 校验失败时抛出业务异常
     */
    private StagedData validate(ScenarioLoadReq req) {
        StagedData staged = new StagedData();
        if (req.getContainers() != null) {
            for (Container container : req.getContainers()) {
                Optional<String> invalid = PlanValidator.validateContainer(container);
                if (invalid.isPresent()) {
                    throw new BusinessException("储物箱 " + container.getContainerId() + " 非法: " + invalid.get());
                }
                if (staged.getContainerMap().put(container.getContainerId(), container) != null) {
                    throw new BusinessException(ErrorCodes.DUPLICATE_CONTAINER + ": " + container.getContainerId());
                }
            }
        }
        if (req.getItems() != null) {
            for (Item item : req.getItems()) {
                if (item.getItemId() == null || item.getItemId().isBlank()) {
                    throw new BusinessException(ErrorCodes.MISSING_ITEM_ID);
                }
                if (staged.getItemMap().put(item.getItemId(), item) != null) {
                    throw new BusinessException(ErrorCodes.DUPLICATE_ITEM + ": " + item.getItemId());
                }
            }
        }
        if (req.getPlacements() != null) {
            for (PlacementDto dto : req.getPlacements()) {
                if (!staged.getItemMap().containsKey(dto.getItemId())) {
                    throw new BusinessException(ErrorCodes.ITEM_NOT_FOUND + ": " + dto.getItemId());
                }
                if (!staged.getContainerMap().containsKey(dto.getContainerId())) {
                    throw new BusinessException(ErrorCodes.CONTAINER_NOT_FOUND + ": " + dto.getContainerId());
                }
                if (dto.getPosition() == null || dto.getPosition().getStartCoordinates() == null
                        || dto.getPosition().getEndCoordinates() == null) {
                    throw new BusinessException(ErrorCodes.INVALID_BOX + ": " + dto.getItemId());
                }
                Box box = dto.getPosition().toBox();
                PlanValidator.validateBox(box).ifPresent(reason -> {
                    throw new BusinessException(reason + ": " + dto.getItemId());
                });
                staged.getPlacementMap().put(dto.getItemId(), new Placement(dto.getItemId(), dto.getContainerId(), box));
            }
        }
        return staged;
    }

    @Getter
    private static class StagedData {
        private final Map<String, Container> containerMap = new LinkedHashMap<>();
        private final Map<String, Item> itemMap = new LinkedHashMap<>();
        private final Map<String, Placement> placementMap = new LinkedHashMap<>();
    }
}
