package qarunner.api;

import qarunner.player.QaRunnerException;

/** The request never produced an HTTP response (DNS, connect, timeout, I/O). */
public class ApiTransportException extends QaRunnerException {

    public ApiTransportException(String msg, Throwable cause) {
        super(msg, cause);
    }
}
