package com.flagship.reconciliation_engine.workflow;

import com.flagship.reconciliation_engine.common.Amounts;
import com.flagship.reconciliation_engine.exception.ValidationException;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Tax deposit details supplied with a submission.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class PaymentMetadata {
    BigDecimal amount;
    LocalDate paymentDate;
    String bankName;
    /** Computerized payment receipt issued by the tax authority. */
    String cprNumber;
    String challanNumber;
    /** Ledger account the deposit was paid from; the configured default bank account when absent. */
    String bankAccountRef;

    /**
     * Amount, when given, must be non-negative with at most 2 decimals and
     * come with the date it was paid.
     *
     * @throws ValidationException listing every broken rule
     */
    public void validate() {
        Map<String, String> errors = new LinkedHashMap<>();
        if (amount != null) {
            if (amount.signum() < 0) {
                errors.put("payment.amount", "must not be negative");
            }
            if (!Amounts.hasCentPrecision(amount)) {
                errors.put("payment.amount", "must have at most 2 decimal places");
            }
            if (paymentDate == null) {
                errors.put("payment.paymentDate", "is required when an amount is given");
            }
        }
        if (!errors.isEmpty()) {
            throw new ValidationException("Invalid payment details", errors);
        }
    }

    /**
     * A deposit is only posted when both an amount and a date were given.
     */
    @JsonIgnore
    public boolean isPostable() {
        return Amounts.isPositive(amount) && paymentDate != null;
    }
}
