package com.metadata.domain.validation;

import com.google.i18n.phonenumbers.NumberParseException;
import com.google.i18n.phonenumbers.PhoneNumberUtil;
import com.google.i18n.phonenumbers.Phonenumber;

import java.util.Optional;
import java.util.Random;

/**
 * International phone number checks backed by libphonenumber.
 *
 * <p>Numbers are parsed without a default region, so only numbers written with a leading
 * {@code +} and country calling code can be parsed. A number is valid when it parses and is
 * both possible (plausible length for its region) and valid (inside an assigned range).
 */
public final class PhoneNumberValidator {

    private static final PhoneNumberUtil PHONE_UTIL = PhoneNumberUtil.getInstance();

    // Israeli fixed-line range (country code 972, area code 8, exchange 6).
    private static final String ISRAELI_PREFIX = "+97286";
    private static final int MAX_GENERATE_ATTEMPTS = 100;

    private PhoneNumberValidator() {}

    /**
     * Returns true if {@code phone} parses and is a possible and valid number.
     * Parse failures are reported as {@code false}, never thrown.
     */
    public static boolean isValid(String phone) {
        return tryParse(phone).map(PhoneNumberValidator::isValid).orElse(false);
    }

    public static boolean isValid(Phonenumber.PhoneNumber number) {
        return PHONE_UTIL.isPossibleNumber(number) && PHONE_UTIL.isValidNumber(number);
    }

    /**
     * Parses {@code phone} with no default region, returning empty when it cannot be parsed.
     */
    public static Optional<Phonenumber.PhoneNumber> tryParse(String phone) {
        if (phone == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(PHONE_UTIL.parse(phone, null));
        } catch (NumberParseException e) {
            return Optional.empty();
        }
    }

    /**
     * Generates a random Israeli number of the form {@code +97286} followed by six digits,
     * drawing again until libphonenumber accepts it as valid.
     *
     * @throws IllegalStateException if no valid number turned up within a bounded number of draws
     */
    public static String generateIsraeli(Random random) {
        for (int attempt = 0; attempt < MAX_GENERATE_ATTEMPTS; attempt++) {
            String candidate = ISRAELI_PREFIX + (100_000 + random.nextInt(900_000));
            if (isValid(candidate)) {
                return candidate;
            }
        }
        throw new IllegalStateException("No valid number generated with prefix " + ISRAELI_PREFIX);
    }
}
