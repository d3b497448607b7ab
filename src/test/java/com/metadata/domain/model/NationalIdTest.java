package com.metadata.domain.model;

import com.metadata.domain.error.ValidationError.NationalIdError;
import com.metadata.domain.validation.IsraeliIdValidator;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class NationalIdTest {

    private static final String VALID_ID = "123456782";

    @Test
    void parseShouldSucceedWithValidId() {
        var result = NationalId.parse(VALID_ID);
        assertTrue(result.isSuccess());
        assertEquals(VALID_ID, result.getOrThrow().value());
    }

    @Test
    void parseShouldTrimSurroundingWhitespace() {
        var result = NationalId.parse("  123456782 ");
        assertTrue(result.isSuccess());
        assertEquals(VALID_ID, result.getOrThrow().value());
    }

    @Test
    void parseShouldKeepShortIdsUnpadded() {
        var result = NationalId.parse("12344");
        assertTrue(result.isSuccess());
        assertEquals("12344", result.getOrThrow().value());
    }

    @Test
    void parseShouldFailWithNullValue() {
        var result = NationalId.parse(null);
        assertTrue(result.isFailure());
        assertInstanceOf(NationalIdError.Empty.class, result.errorOrNull());
    }

    @Test
    void parseShouldFailWithBlankValue() {
        var result = NationalId.parse("   ");
        assertTrue(result.isFailure());
        assertInstanceOf(NationalIdError.Empty.class, result.errorOrNull());
    }

    @Test
    void parseShouldFailWithNonDigits() {
        var result = NationalId.parse("12345678a");
        assertTrue(result.isFailure());
        assertInstanceOf(NationalIdError.InvalidFormat.class, result.errorOrNull());
        assertEquals("ID_INVALID_FORMAT", result.errorOrNull().code());
    }

    @Test
    void parseShouldFailWithTooManyDigits() {
        var result = NationalId.parse("1234567820");
        assertInstanceOf(NationalIdError.InvalidFormat.class, result.errorOrNull());
    }

    @Test
    void parseShouldFailWithBadChecksum() {
        var result = NationalId.parse("123456780");
        assertTrue(result.isFailure());
        var error = assertInstanceOf(NationalIdError.InvalidChecksum.class, result.errorOrNull());
        assertEquals("123456780", error.value());
        assertEquals("id", error.field());
    }

    @Test
    void fromTrustedShouldWrapValidValue() {
        assertEquals(VALID_ID, NationalId.fromTrusted(VALID_ID).value());
    }

    @Test
    void fromTrustedShouldThrowOnCorruptedValue() {
        assertThrows(IllegalStateException.class, () -> NationalId.fromTrusted("123456780"));
    }

    @Test
    void constructorShouldRejectNull() {
        assertThrows(IllegalStateException.class, () -> new NationalId(null));
    }

    @Test
    void randomShouldProduceValidNineDigitId() {
        NationalId id = NationalId.random();
        assertEquals(9, id.value().length());
        assertTrue(IsraeliIdValidator.isValid(id.value()));
    }

    @Test
    void equalIdsShouldBeEqual() {
        assertEquals(NationalId.fromTrusted(VALID_ID), NationalId.parse(VALID_ID).getOrThrow());
        assertEquals(VALID_ID, NationalId.fromTrusted(VALID_ID).toString());
    }
}
