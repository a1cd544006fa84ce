package model.dto.response;

import common.consts.StepActionEnum;
import engine.RearrangementStep;
import lombok.Data;
import model.entity.Position;

/**
 * 腾挪步骤
 */
@Data
public class RearrangementStepDto {
    private int step;
    private StepActionEnum action;
    private String itemId;
    private String fromContainer;
    private Position fromPosition;
    private String toContainer;
    private Position toPosition;

    public static RearrangementStepDto from(RearrangementStep source) {
        RearrangementStepDto dto = new RearrangementStepDto();
        dto.setStep(source.getStep());
        dto.setAction(source.getAction());
        dto.setItemId(source.getItemId());
        dto.setFromContainer(source.getFromContainer());
        dto.setFromPosition(source.getFromBox().toPosition());
        dto.setToContainer(source.getToContainer());
        dto.setToPosition(source.getToBox().toPosition());
        return dto;
    }
}
