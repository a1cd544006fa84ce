package service.log;

import common.consts.LogActionTypeEnum;
import model.dto.snapshot.ActionLogEntryDto;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 操作日志 (内存中保留最近 N 条)
 */
@Component
public class ActionLogService {

    private final int capacity;

    private final Deque<ActionLogEntryDto> buffer;

    public ActionLogService(@Value("${cargo.log.capacity:1000}") int capacity) {
        this.capacity = capacity;
        this.buffer = new ArrayDeque<>(capacity);
    }

    public void record(LogActionTypeEnum actionType, String itemId, String userId,
                       LocalDateTime timestamp, Map<String, Object> details) {
        ActionLogEntryDto entry = new ActionLogEntryDto();
        entry.setActionType(actionType);
        entry.setItemId(itemId);
        entry.setUserId(userId);
        entry.setTimestamp(timestamp != null ? timestamp : LocalDateTime.now());
        entry.setDetails(details != null ? new LinkedHashMap<>(details) : new LinkedHashMap<>());
        append(entry);
    }

    private synchronized void append(ActionLogEntryDto entry) {
        if (buffer.size() >= capacity) {
            buffer.removeFirst();
        }
        buffer.addLast(entry);
    }

    /**
     * 按条件过滤, 条件为空表示不限
     */
    public synchronized List<ActionLogEntryDto> query(String itemId, String userId, LogActionTypeEnum actionType,
                                                      LocalDateTime from, LocalDateTime to) {
        List<ActionLogEntryDto> result = new ArrayList<>();
        for (ActionLogEntryDto entry : buffer) {
            if (itemId != null && !itemId.equals(entry.getItemId())) continue;
            if (userId != null && !userId.equals(entry.getUserId())) continue;
            if (actionType != null && actionType != entry.getActionType()) continue;
            if (from != null && entry.getTimestamp().isBefore(from)) continue;
            if (to != null && entry.getTimestamp().isAfter(to)) continue;
            result.add(entry);
        }
        return result;
    }

    public synchronized List<ActionLogEntryDto> listAll() {
        return new ArrayList<>(buffer);
    }

    public synchronized void clear() {
        buffer.clear();
    }
}
