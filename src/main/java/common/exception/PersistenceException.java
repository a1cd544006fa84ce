package common.exception;

import java.util.List;

/**
 * 规划结果提交失败
 * 抛出时存储中的数据保持提交前的状态, 不存在部分写入
 */
public class PersistenceException extends RuntimeException {
    private final List<String> violations;

    public PersistenceException(String message, List<String> violations) {
        super(message);
        this.violations = violations == null ? List.of() : List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
