package net.legacy.unit.foundation.runner;

import lombok.Value;

/**
 * A test that did not pass, with the message printed in the failures section.
 *
 * @author qwq-dev
 * @since 2025-06-14 13:00
 */
@Value
public class FailureRecord {
    String testName;
    TestOutcome outcome;
    String message;
}
