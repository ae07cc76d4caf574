package mailgate.core.model.oauth;

import java.util.Optional;

/**
 * Decision submitted from the consent form.
 */
public enum ConsentAction {
    APPROVE("approve"),
    DENY("deny");

    private final String value;

    ConsentAction(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * Parse a submitted action. A missing action means approval.
     *
     * @param value the submitted form value, may be null
     * @return the action, or empty for an unsupported value
     */
    public static Optional<ConsentAction> fromValue(String value) {
        if (value == null) {
            return Optional.of(APPROVE);
        }
        for (ConsentAction action : values()) {
            if (action.value.equals(value)) {
                return Optional.of(action);
            }
        }
        return Optional.empty();
    }
}
