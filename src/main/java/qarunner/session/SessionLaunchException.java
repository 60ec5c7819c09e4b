package qarunner.session;

import qarunner.player.QaRunnerException;

/** A browser could not be started. */
public class SessionLaunchException extends QaRunnerException {

    public SessionLaunchException(String msg, Throwable cause) {
        super(msg, cause);
    }
}
