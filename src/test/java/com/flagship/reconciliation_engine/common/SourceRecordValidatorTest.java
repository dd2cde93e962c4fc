package com.flagship.reconciliation_engine.common;

import com.flagship.reconciliation_engine.exception.ErrorCode;
import com.flagship.reconciliation_engine.exception.ValidationException;
import jakarta.validation.Validation;
import jakarta.validation.ValidatorFactory;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SourceRecordValidatorTest {

    private static ValidatorFactory factory;
    private static SourceRecordValidator validator;

    @BeforeAll
    static void setUp() {
        factory = Validation.buildDefaultValidatorFactory();
        validator = new SourceRecordValidator(factory.getValidator());
    }

    @AfterAll
    static void tearDown() {
        factory.close();
    }

    private static RawSourceRecord.RawSourceRecordBuilder valid() {
        return RawSourceRecord.builder()
            .amount("1250.50")
            .timestamp(Instant.parse("2024-03-05T09:00:00Z"))
            .descriptor("  Consultancy fee  ")
            .origin(SourceOrigin.VENDOR_PAYMENT)
            .counterparty("Vendor A")
            .withheldAmount("100.04");
    }

    @Test
    @DisplayName("Valid record is converted with exact amounts and a new id")
    void validRecord() {
        SourceRecord record = validator.validate(valid().build());

        assertNotNull(record.getId());
        assertEquals(new BigDecimal("1250.50"), record.getAmount());
        assertEquals(new BigDecimal("100.04"), record.getWithheldAmount());
        assertEquals("Consultancy fee", record.getDescriptor());
    }

    @Test
    @DisplayName("Amount with three decimals is rejected")
    void subCentAmount() {
        ValidationException e = assertThrows(ValidationException.class,
            () -> validator.validate(valid().amount("10.005").build()));

        assertEquals(ErrorCode.VALIDATION_FAILED, e.getErrorCode());
        assertTrue(e.getDetails().containsKey("records[0].amount"));
    }

    @Test
    @DisplayName("Missing fields are all reported for the failing record")
    void missingFields() {
        RawSourceRecord broken = RawSourceRecord.builder().amount("abc").build();

        ValidationException e = assertThrows(ValidationException.class,
            () -> validator.validateAll(List.of(valid().build(), broken)));

        assertTrue(e.getDetails().containsKey("records[1].amount"));
        assertTrue(e.getDetails().containsKey("records[1].timestamp"));
        assertTrue(e.getDetails().containsKey("records[1].descriptor"));
        assertTrue(e.getDetails().containsKey("records[1].origin"));
        assertFalse(e.getDetails().keySet().stream().anyMatch(k -> k.startsWith("records[0]")));
    }

    @Test
    @DisplayName("Withheld amount above the gross is rejected")
    void withheldAboveGross() {
        ValidationException e = assertThrows(ValidationException.class,
            () -> validator.validate(valid().amount("100.00").withheldAmount("150.00").build()));

        assertTrue(e.getDetails().containsKey("records[0].withheldAmount"));
    }

    @Test
    @DisplayName("Empty batch is rejected")
    void emptyBatch() {
        assertThrows(ValidationException.class, () -> validator.validateAll(List.of()));
    }
}
