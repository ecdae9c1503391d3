package kaspi.lab.attachmentService.validation;

public record ValidationResult(boolean valid, String reason) {

    private static final ValidationResult OK = new ValidationResult(true, "");

    public static ValidationResult ok() {
        return OK;
    }

    public static ValidationResult rejected(String reason) {
        return new ValidationResult(false, reason);
    }
}
