package model.dto.response;

import engine.RetrievalStep;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 货物查询响应, 附带取货步骤
 */
@Data
public class SearchResp {
    private boolean found;
    private ItemLocationDto item;
    private List<RetrievalStep> retrievalSteps = new ArrayList<>();
}
