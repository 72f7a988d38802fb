package quota.core.model;

public enum RegistrationOutcome {
    CREATED,
    OVERWRITTEN,
    CONFLICT
}
