package com.nova.domain.intent.model.valobj;

import com.nova.types.enums.IntentTypeEnum;

/**
 * 单个意图及其置信度，置信度取值 [0,1]。
 */
public record IntentScore(IntentTypeEnum intent, double confidence) {

    public IntentScore {
        if (intent == null) {
            throw new IllegalStateException("Intent cannot be null");
        }
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new IllegalStateException("Intent confidence must be within [0,1]: " + confidence);
        }
    }
}
