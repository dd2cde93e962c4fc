package com.flagship.reconciliation_engine.common;

import com.flagship.reconciliation_engine.exception.ValidationException;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Turns raw ingestion input into {@link SourceRecord}s.
 *
 * A batch is all-or-nothing: if any record fails, nothing is returned and the
 * {@link ValidationException} lists every failing field, keyed as
 * {@code records[i].field}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SourceRecordValidator {

    private final Validator validator;

    public SourceRecord validate(RawSourceRecord raw) {
        return validateAll(List.of(raw)).get(0);
    }

    public List<SourceRecord> validateAll(List<RawSourceRecord> raws) {
        if (raws == null || raws.isEmpty()) {
            throw new ValidationException("At least one source record is required");
        }

        Map<String, String> errors = new LinkedHashMap<>();
        for (int i = 0; i < raws.size(); i++) {
            RawSourceRecord raw = raws.get(i);
            String prefix = "records[" + i + "].";
            if (raw == null) {
                errors.put("records[" + i + "]", "Record is required");
                continue;
            }
            Set<ConstraintViolation<RawSourceRecord>> violations = validator.validate(raw);
            for (ConstraintViolation<RawSourceRecord> violation : violations) {
                errors.putIfAbsent(prefix + violation.getPropertyPath(), violation.getMessage());
            }
            if (violations.isEmpty() && raw.getWithheldAmount() != null) {
                BigDecimal gross = new BigDecimal(raw.getAmount());
                BigDecimal withheld = new BigDecimal(raw.getWithheldAmount());
                if (withheld.abs().compareTo(gross.abs()) > 0) {
                    errors.put(prefix + "withheldAmount", "Withheld amount cannot exceed the gross amount");
                }
            }
        }

        if (!errors.isEmpty()) {
            log.warn("Rejected source record batch: size={}, errors={}", raws.size(), errors);
            throw new ValidationException("Source record validation failed", errors);
        }

        List<SourceRecord> records = new ArrayList<>(raws.size());
        for (RawSourceRecord raw : raws) {
            records.add(toRecord(raw));
        }
        return records;
    }

    private SourceRecord toRecord(RawSourceRecord raw) {
        return SourceRecord.builder()
            .id(UUID.randomUUID())
            .amount(new BigDecimal(raw.getAmount()))
            .timestamp(raw.getTimestamp())
            .descriptor(raw.getDescriptor().trim())
            .categoryTag(raw.getCategoryTag())
            .origin(raw.getOrigin())
            .originReference(raw.getOriginReference())
            .counterparty(raw.getCounterparty())
            .withheldAmount(raw.getWithheldAmount() == null ? null : new BigDecimal(raw.getWithheldAmount()))
            .build();
    }
}
