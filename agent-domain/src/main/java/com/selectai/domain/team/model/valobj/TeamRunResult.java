package com.selectai.domain.team.model.valobj;

import com.selectai.types.enums.TeamRunStatusEnum;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Team 单轮运行结果
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TeamRunResult {

    private String conversationId;

    private TeamRunStatusEnum status;

    /**
     * 数据库返回的原始文本
     */
    private String text;

    /**
     * 返回文本为 JSON 对象时的解析结果，否则为 null
     */
    private Map<String, Object> payload;

    public boolean isHumanInputRequired() {
        return status == TeamRunStatusEnum.HUMAN_INPUT_REQUIRED;
    }
}
