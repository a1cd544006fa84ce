package common.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * 装载搜索与数值容差配置
 * 与空间搜索精度相关的参数统一在这里管理, 避免在代码各处硬编码。
 *
 * 均有缺省值, 可以通过 Spring 配置文件覆盖：
 *
 * cargo.placement.tolerance
 * cargo.placement.grid-divisions
 * cargo.placement.min-grid-step
 * cargo.placement.precision
 * cargo.placement.high-priority-threshold
 */
@Configuration
@ConfigurationProperties(prefix = "cargo.placement")
@Data
public class PlacementConfig {

    /**
     * 浮点比较的绝对容差
     */
    private double tolerance = 1e-6;

    /**
     * 网格划分份数 (步长 = 储物箱该轴尺寸 / 份数)
     */
    private int gridDivisions = 20;

    /**
     * 网格最小步长, 防止极小储物箱的搜索量膨胀
     */
    private double minGridStep = 0.05;

    /**
     * 坐标取整的小数位数
     */
    private int precision = 3;

    /**
     * 高优先级阈值: 优先级不低于该值的货物优先放在靠近舱口的位置
     */
    private int highPriorityThreshold = 50;
}
