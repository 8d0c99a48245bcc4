package com.williamcallahan.llmgateway.config;

import com.williamcallahan.llmgateway.service.LlmActiveTimeBudget;
import com.williamcallahan.llmgateway.service.LlmActiveWindowListener;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.boot.actuate.info.Info;
import org.springframework.boot.actuate.info.InfoContributor;
import org.springframework.stereotype.Component;

/**
 * Publishes the LLM active-time budget under {@code /actuator/info}.
 *
 * <p>Contributes nothing when the active-window listener is not an {@link LlmActiveTimeBudget}.
 */
@Component
public class LlmActiveTimeInfoContributor implements InfoContributor {

    /** Info key holding the budget snapshot. */
    static final String INFO_KEY = "llmActiveTime";

    private final LlmActiveWindowListener activeWindowListener;

    public LlmActiveTimeInfoContributor(LlmActiveWindowListener activeWindowListener) {
        this.activeWindowListener = activeWindowListener;
    }

    @Override
    public void contribute(Info.Builder builder) {
        if (!(activeWindowListener instanceof LlmActiveTimeBudget budget)) {
            return;
        }
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("activeMillis", budget.activeMillis());
        if (budget.limit() != null) {
            details.put("limitSeconds", budget.limit().toSeconds());
            details.put("remainingSeconds", budget.remainingSeconds());
        }
        details.put("exceeded", budget.exceeded());
        builder.withDetail(INFO_KEY, details);
    }
}
