package guraa.photoclean.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

import java.util.Locale;

/**
 * A non-keeper member of a duplicate group.
 */
@Getter
@SuperBuilder
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class DuplicateRow extends ScanRow {

    @JsonIgnore
    private final int groupId;

    @JsonIgnore
    private final String keepPath;

    @JsonIgnore
    private final int distance;

    @JsonIgnore
    private final double keepBlur;

    @JsonIgnore
    private final double candidateBlur;

    @Override
    public RowKind getKind() {
        return RowKind.DUPLICATE;
    }

    @Override
    public Integer getGroup() {
        return groupId;
    }

    @Override
    public String getKeep() {
        return keepPath;
    }

    @Override
    public String getRelation() {
        return String.format(Locale.ROOT, "distance=%d; keep_blur=%.6f; candidate_blur=%.6f",
                distance, keepBlur, candidateBlur);
    }
}
