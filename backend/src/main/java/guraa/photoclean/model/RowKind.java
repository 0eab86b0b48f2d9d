package guraa.photoclean.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The two shapes of scan output rows.
 */
public enum RowKind {
    BLUR("blur"),
    DUPLICATE("duplicate");

    private final String label;

    RowKind(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }
}
