package org.iceforge.quarry.quota;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Rolling-window token quota. The window ends at the clock's current instant on every call;
 * nothing is reset on a schedule.
 */
public class QuotaService {
    private static final Logger logger = LoggerFactory.getLogger(QuotaService.class);

    private final UsageLedger ledger;
    private final long limitTokens;
    private final Duration window;
    private final double warningPercent;
    private final Clock clock;

    public QuotaService(UsageLedger ledger, QuotaProperties props, Clock clock) {
        this(ledger, props.getLimitTokens(), props.getWindow(), props.getWarningPercent(), clock);
    }

    public QuotaService(UsageLedger ledger, long limitTokens, Duration window, double warningPercent, Clock clock) {
        this.ledger = Objects.requireNonNull(ledger, "ledger");
        if (limitTokens <= 0) {
            throw new IllegalArgumentException("limitTokens must be > 0");
        }
        this.limitTokens = limitTokens;
        this.window = Objects.requireNonNull(window, "window");
        this.warningPercent = warningPercent;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public QuotaStatus checkLimit(String userId) {
        Instant now = clock.instant();
        WindowUsage usage = ledger.usageSince(userId, now.minus(window));

        long used = usage.tokens();
        double percent = used * 100.0 / limitTokens;
        Long resetsIn = null;
        if (usage.oldestRecord() != null) {
            long seconds = Duration.between(now, usage.oldestRecord().plus(window)).getSeconds();
            resetsIn = Math.max(0, seconds);
        }
        return new QuotaStatus(
                used < limitTokens,
                used,
                limitTokens,
                Math.max(0, limitTokens - used),
                resetsIn,
                percent,
                percent >= warningPercent);
    }

    /**
     * @throws QuotaExceededException when the user has no tokens left in the window
     */
    public QuotaStatus requireAllowed(String userId) {
        QuotaStatus status = checkLimit(userId);
        if (!status.allowed()) {
            logger.info("User {} is over quota ({} of {} tokens)", userId, status.usageTokens(), status.limitTokens());
            throw new QuotaExceededException(userId, status);
        }
        if (status.warning()) {
            logger.debug("User {} at {}% of quota", userId, String.format("%.1f", status.usagePercent()));
        }
        return status;
    }

    public UsageRecord recordUsage(String userId, long inputTokens, long outputTokens) {
        if (inputTokens < 0 || outputTokens < 0) {
            throw new IllegalArgumentException("token counts must be >= 0");
        }
        UsageRecord record = ledger.append(userId, inputTokens, outputTokens, clock.instant());
        logger.debug("Recorded {} tokens for {}", record.totalTokens(), userId);
        return record;
    }
}
