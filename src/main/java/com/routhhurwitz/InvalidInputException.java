package com.routhhurwitz;

/**
 * Thrown when a coefficient sequence cannot describe a polynomial: it is
 * empty, every entry is (near-)zero, or an entry is not a finite number.
 * Raised before any table is built; no partial result exists.
 */
public class InvalidInputException extends IllegalArgumentException {

    public InvalidInputException(String message) {
        super(message);
    }
}
