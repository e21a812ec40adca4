package net.legacy.unit.foundation.util;

import lombok.experimental.UtilityClass;

import java.util.Collection;

/**
 * Argument validation helpers shared by the harness API.
 *
 * @author qwq-dev
 * @since 2025-06-14 10:05
 */
@UtilityClass
public class ValidationUtil {

    /**
     * Checks if the string is null or contains only whitespace.
     *
     * @param inputString string to check
     * @return true if the string is blank, false otherwise
     */
    public static boolean isBlank(String inputString) {
        return inputString == null || inputString.trim().isEmpty();
    }

    /**
     * Ensures that the object is not null, throws {@link IllegalArgumentException} if it is null.
     *
     * @param value   object to check
     * @param message exception message
     * @param <T>     object type
     * @return the non-null object
     * @throws IllegalArgumentException if the object is null
     */
    public static <T> T requireNonNull(T value, String message) {
        if (value == null) {
            throw new IllegalArgumentException(message);
        }
        return value;
    }

    /**
     * Ensures that the string is not blank.
     *
     * @param inputString string to check
     * @param message     exception message
     * @throws IllegalArgumentException if the string is blank
     */
    public static void requireNotBlank(String inputString, String message) {
        if (isBlank(inputString)) {
            throw new IllegalArgumentException(message);
        }
    }

    /**
     * Ensures that the array is neither null nor empty.
     *
     * @param array   array to check
     * @param message exception message
     * @param <T>     element type
     * @throws IllegalArgumentException if the array is null or empty
     */
    public static <T> void requireNotEmpty(T[] array, String message) {
        if (array == null || array.length == 0) {
            throw new IllegalArgumentException(message);
        }
    }

    /**
     * Ensures that the collection is neither null nor empty.
     *
     * @param collection collection to check
     * @param message    exception message
     * @throws IllegalArgumentException if the collection is null or empty
     */
    public static void requireNotEmpty(Collection<?> collection, String message) {
        if (collection == null || collection.isEmpty()) {
            throw new IllegalArgumentException(message);
        }
    }
}
