package com.flagship.general_ledger.integrity;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Value
@Builder
public class IntegrityReport {
    String tenantId;
    Instant checkedAt;
    int accountsChecked;
    int entriesChecked;
    @Singular
    List<BalanceDrift> drifts;
    /** Accounts whose stored balance has the wrong sign. */
    @Singular
    List<String> polarityViolations;
    /** {@code entryId:accountCode} for lines naming accounts that do not exist. */
    @Singular
    List<String> unknownAccountReferences;
    /** {@code entryId:accountCode:currency} for lines that do not settle in their account's currency. */
    @Singular
    List<String> currencyMismatches;

    public boolean isHealthy() {
        return issueCount() == 0;
    }

    @JsonProperty("issueCount")
    public int issueCount() {
        return drifts.size() + polarityViolations.size() + unknownAccountReferences.size() + currencyMismatches.size();
    }

    /**
     * One human-readable line per issue.
     */
    @JsonProperty("issues")
    public List<String> describeIssues() {
        List<String> issues = new ArrayList<>();
        drifts.forEach(drift -> issues.add(String.format(
            "Account %s stored balance %s differs from journal balance %s by %s%s",
            drift.getAccountCode(), drift.getActual(), drift.getExpected(), drift.getDifference(),
            drift.getFirstOffendingEntryId() != null ? " (see entry " + drift.getFirstOffendingEntryId() + ")" : "")));
        polarityViolations.forEach(code -> issues.add("Account " + code + " violates its balance polarity"));
        unknownAccountReferences.forEach(ref -> issues.add("Journal line references unknown account: " + ref));
        currencyMismatches.forEach(ref -> issues.add("Journal line does not settle in its account currency: " + ref));
        return issues;
    }
}
