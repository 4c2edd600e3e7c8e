package org.javai.backoff.wait;

import java.util.NoSuchElementException;

/**
 * Thrown when a finite wait sequence has yielded all of its values.
 * A retry loop treats this as a give-up.
 */
public class WaitSequenceExhaustedException extends NoSuchElementException {

    public WaitSequenceExhaustedException(String message) {
        super(message);
    }
}
