package org.lite.registry.dto;

import lombok.Builder;
import lombok.Data;
import org.lite.registry.enums.GateRuleKind;
import org.lite.registry.enums.GateStatus;

@Data
@Builder
public class GateEvaluation {
    private String ruleId;
    private String ruleName;
    private GateRuleKind kind;
    private GateStatus status;
    private String message;
    private boolean blocking;
}
