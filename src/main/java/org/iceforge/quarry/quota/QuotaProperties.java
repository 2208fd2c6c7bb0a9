package org.iceforge.quarry.quota;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Per-user token allowance over a rolling window.
 */
@ConfigurationProperties(prefix = "quarry.quota")
public class QuotaProperties {

    private long limitTokens = 5_000_000L;

    /** Length of the rolling window; usage older than this no longer counts. */
    private Duration window = Duration.ofHours(24);

    /** Usage percentage from which a status carries the warning flag. */
    private double warningPercent = 80;

    public long getLimitTokens() {
        return limitTokens;
    }

    public void setLimitTokens(long limitTokens) {
        this.limitTokens = limitTokens;
    }

    public Duration getWindow() {
        return window;
    }

    public void setWindow(Duration window) {
        this.window = window;
    }

    public double getWarningPercent() {
        return warningPercent;
    }

    public void setWarningPercent(double warningPercent) {
        this.warningPercent = warningPercent;
    }
}
