package qarunner.scheduler;

import qarunner.player.QaRunnerException;

/** A schedule's frequency string cannot be turned into a trigger. */
public class InvalidRecurrenceException extends QaRunnerException {

    public InvalidRecurrenceException(String msg) {
        super(msg);
    }

    public InvalidRecurrenceException(String msg, Throwable cause) {
        super(msg, cause);
    }
}
