package com.metadata.domain.validation;

import java.util.Random;

/**
 * Checksum rules for Israeli national ID numbers (Teudat Zehut).
 *
 * <p>An ID is 5 to 9 digits. It is left-padded with zeros to 9 digits, then every digit is
 * multiplied by 1 or 2 depending on its position (1 at even 0-based positions, 2 at odd ones,
 * counted from the left). Two-digit products are reduced by 9. The ID is valid when the sum of
 * the reduced products is divisible by 10.
 *
 * <p>All methods are stateless and safe to call from any thread.
 */
public final class IsraeliIdValidator {

    public static final int MIN_LENGTH = 5;
    public static final int MAX_LENGTH = 9;

    private IsraeliIdValidator() {}

    /**
     * Returns true if {@code id} is 5-9 ASCII digits with a valid checksum.
     * Never throws; {@code null} is simply invalid.
     */
    public static boolean isValid(String id) {
        return hasValidFormat(id) && checksum(id) % 10 == 0;
    }

    /**
     * Returns true if {@code id} is 5-9 ASCII digits, regardless of checksum.
     */
    public static boolean hasValidFormat(String id) {
        if (id == null || id.length() < MIN_LENGTH || id.length() > MAX_LENGTH) {
            return false;
        }
        for (int i = 0; i < id.length(); i++) {
            char c = id.charAt(i);
            if (c < '0' || c > '9') {
                return false;
            }
        }
        return true;
    }

    /**
     * Generates a random valid 9-digit ID.
     */
    public static String generate(Random random) {
        return generate(random, MAX_LENGTH);
    }

    /**
     * Generates a random valid ID of the given length: {@code length - 1} random digits
     * followed by the first check digit that satisfies the checksum.
     *
     * @throws IllegalArgumentException if length is outside 5-9
     */
    public static String generate(Random random, int length) {
        if (length < MIN_LENGTH || length > MAX_LENGTH) {
            throw new IllegalArgumentException(
                "ID length must be between " + MIN_LENGTH + " and " + MAX_LENGTH + ": " + length);
        }
        StringBuilder prefix = new StringBuilder(length);
        for (int i = 0; i < length - 1; i++) {
            prefix.append((char) ('0' + random.nextInt(10)));
        }
        for (int check = 0; check <= 9; check++) {
            String candidate = prefix.toString() + check;
            if (isValid(candidate)) {
                return candidate;
            }
        }
        // The last padded position always has weight 1, so one of the ten check digits must fit.
        throw new IllegalStateException("Failed to compute a check digit for prefix " + prefix);
    }

    private static int checksum(String id) {
        int padding = MAX_LENGTH - id.length();
        int total = 0;
        for (int idx = padding; idx < MAX_LENGTH; idx++) {
            int digit = id.charAt(idx - padding) - '0';
            int product = digit * (idx % 2 == 0 ? 1 : 2);
            total += product > 9 ? product - 9 : product;
        }
        return total;
    }
}
