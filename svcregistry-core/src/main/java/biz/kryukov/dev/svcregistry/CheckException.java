package biz.kryukov.dev.svcregistry;

/**
 * Base check exception with failure classification.
 *
 * <p>Checkers raise subclasses internally and convert them into a {@link CheckOutcome}
 * at their boundary; {@link #statusCategory()} ends up in the outcome and in the
 * {@code category} field of the status report.</p>
 */
public class CheckException extends Exception {

    private final String statusCategory;

    public CheckException(String message, String statusCategory) {
        super(message);
        this.statusCategory = statusCategory;
    }

    public CheckException(String message, Throwable cause, String statusCategory) {
        super(message, cause);
        this.statusCategory = statusCategory;
    }

    /** Returns the status category for this error. */
    public String statusCategory() {
        return statusCategory;
    }
}
