package org.lite.registry.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import org.lite.registry.enums.GateRuleKind;

@Value
@Builder
public class QualityGateRule {
    @NonNull String id;
    @NonNull String name;
    @Builder.Default boolean blocking = true;
    @NonNull GateRuleParameters parameters;

    public GateRuleKind getKind() {
        return parameters.kind();
    }
}
