package com.flagship.general_ledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.transaction.annotation.EnableTransactionManagement;

/**
 * Multi-tenant double-entry general ledger.
 *
 * Postings, reversals and period transitions are serialized per tenant; the
 * journal is append-only and every balance can be rebuilt from it.
 */
@SpringBootApplication
@EnableTransactionManagement
public class GeneralLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(GeneralLedgerApplication.class, args);
    }
}
