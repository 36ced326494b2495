package com.vcc.copilot.error;

import com.vcc.copilot.model.QuotaStatus;

/**
 * Daily request quota exhausted. Carries the status so callers can show when it resets.
 */
public class QuotaExceededException extends CopilotException {

    private final QuotaStatus status;
    private final String upgradeUrl;

    public QuotaExceededException(QuotaStatus status, String upgradeUrl) {
        super(ErrorKind.QUOTA_EXCEEDED, "RATE_LIMIT_EXCEEDED",
                "Daily copilot limit of " + status.limit() + " requests reached for the "
                        + status.tier().wireName() + " plan. Upgrade your plan for more requests, "
                        + "or try again after " + status.resetAt() + ".");
        this.status = status;
        this.upgradeUrl = upgradeUrl;
    }

    public QuotaStatus getQuotaStatus() {
        return status;
    }

    public String getUpgradeUrl() {
        return upgradeUrl;
    }
}
