package io.github.cyfko.entityql.core.utils;

/**
 * Outcome of a validation: either success, or failure with a message.
 * <p>
 * Instances are immutable and created via {@link #success()} and {@link #failure(String)}.
 * </p>
 *
 * <pre>{@code
 * ValidationResult result = OperatorValidationUtils.validate(Op.IN, operand);
 * if (!result.isValid()) {
 *     throw new InvalidConditionException(result.getErrorMessage());
 * }
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class ValidationResult {

    private static final ValidationResult SUCCESS = new ValidationResult(true, null);

    private final boolean valid;
    private final String errorMessage;

    private ValidationResult(boolean valid, String errorMessage) {
        this.valid = valid;
        this.errorMessage = errorMessage;
    }

    public static ValidationResult success() {
        return SUCCESS;
    }

    public static ValidationResult failure(String errorMessage) {
        return new ValidationResult(false, errorMessage);
    }

    public boolean isValid() {
        return valid;
    }

    /**
     * @return the failure message, or {@code null} when valid
     */
    public String getErrorMessage() {
        return errorMessage;
    }

    @Override
    public String toString() {
        return valid ? "ValidationResult[valid=true]"
                : "ValidationResult[valid=false, error=" + errorMessage + "]";
    }
}
