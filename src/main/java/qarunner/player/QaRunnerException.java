package qarunner.player;

/**
 * Unchecked base exception for all runner components: a step that cannot be
 * completed, a session that cannot be launched, a plan that does not exist.
 */
public class QaRunnerException extends RuntimeException {

    public QaRunnerException(String msg) {
        super(msg);
    }

    public QaRunnerException(String msg, Throwable cause) {
        super(msg, cause);
    }
}
