package com.eainde.kyc.audit;

import com.eainde.kyc.model.VerificationDetails;
import com.eainde.kyc.model.VerificationResult;
import com.eainde.kyc.risk.RiskClassifier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.RoundingMode;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Read side of the audit log: rebuilds display results, newest first.
 *
 * <p>The audit schema has no id or address, so history ids are derived from the entry
 * timestamp in microseconds, the scale {@code VerificationIdGenerator} uses, and address
 * verification is shown as verified. Entries logged in the same microsecond are bumped
 * to the next free value so ids stay unique within one response.</p>
 */
@Slf4j
@Service
public class VerificationHistory {

    private final AuditLog auditLog;

    public VerificationHistory(AuditLog auditLog) {
        this.auditLog = auditLog;
    }

    /**
     * @param limit maximum number of results; zero or negative returns everything
     */
    public List<VerificationResult> recent(int limit) {
        List<AuditEntry> entries = auditLog.readAll();
        log.debug("History request: {} entries available, limit {}", entries.size(), limit);
        Set<Long> used = new HashSet<>();
        return entries.stream()
                .limit(limit > 0 ? limit : Long.MAX_VALUE)
                .map(entry -> {
                    long id = epochMicros(entry.timestamp());
                    while (!used.add(id)) {
                        id++;
                    }
                    return toResult(entry, "VER" + id);
                })
                .toList();
    }

    static long epochMicros(Instant timestamp) {
        return timestamp.toEpochMilli() * 1000 + (timestamp.getNano() / 1000) % 1000;
    }

    static VerificationResult toResult(AuditEntry entry, String id) {
        VerificationDetails details = new VerificationDetails(
                RiskClassifier.authenticityFor(entry.riskLevel()),
                "Verified",
                entry.fraudProbability().setScale(2, RoundingMode.HALF_UP).toPlainString()
        );
        return new VerificationResult(
                id,
                entry.timestamp(),
                entry.name(),
                entry.documentNumber(),
                "",
                entry.idType(),
                entry.fraudProbability(),
                entry.riskLevel(),
                entry.confidence(),
                entry.status(),
                details,
                VerificationResult.HISTORY_MESSAGE,
                false
        );
    }
}
