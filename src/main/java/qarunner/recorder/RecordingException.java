package qarunner.recorder;

import qarunner.player.QaRunnerException;

/** A recording session could not be started. */
public class RecordingException extends QaRunnerException {

    public RecordingException(String msg, Throwable cause) {
        super(msg, cause);
    }
}
