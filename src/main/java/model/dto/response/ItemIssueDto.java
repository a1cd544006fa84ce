package model.dto.response;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ItemIssueDto {
    private String itemId;
    private String errorCode; // 见 PlanErrorEnum
    private String reason;
}
