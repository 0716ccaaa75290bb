package agentyard.platform;

/**
 * Backend view of a submitted build.
 *
 * @param detail failure detail when {@link State#FAILED}, otherwise optional
 */
public record BuildProgress(State state, String detail) {

    public enum State {
        PENDING,
        RUNNING,
        SUCCEEDED,
        FAILED
    }

    public static BuildProgress pending() {
        return new BuildProgress(State.PENDING, null);
    }

    public static BuildProgress running() {
        return new BuildProgress(State.RUNNING, null);
    }

    public static BuildProgress succeeded() {
        return new BuildProgress(State.SUCCEEDED, null);
    }

    public static BuildProgress failed(String detail) {
        return new BuildProgress(State.FAILED, detail);
    }

    public boolean isFinished() {
        return state == State.SUCCEEDED || state == State.FAILED;
    }
}
