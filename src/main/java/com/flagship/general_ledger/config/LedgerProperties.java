package com.flagship.general_ledger.config;

import com.flagship.general_ledger.money.CurrencyCode;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Ledger settings bound from {@code ledger.*}.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "ledger")
public class LedgerProperties {

    /** Currency financial statements are expressed in. */
    private CurrencyCode reportingCurrency = CurrencyCode.USD;

    private Posting posting = new Posting();

    private Period period = new Period();

    @Data
    public static class Posting {
        /** How long a writer waits for the tenant's posting section. */
        private Duration lockTimeout = Duration.ofSeconds(5);
        private int maxLines = 100;
    }

    @Data
    public static class Period {
        /**
         * Global switch for the CLOSED-period exceptions (adjusting, reversal
         * and closing entries). When false a CLOSED period accepts nothing.
         */
        private boolean allowAdjustmentsInClosed = true;
    }
}
