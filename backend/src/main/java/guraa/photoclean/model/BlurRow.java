package guraa.photoclean.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

import java.util.Locale;

/**
 * A file classified as blurry.
 */
@Getter
@SuperBuilder
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class BlurRow extends ScanRow {

    @JsonIgnore
    private final double blurScore;

    /**
     * Tenengrad score, present only when the Tenengrad gate took part in the decision.
     */
    @JsonIgnore
    private final Double tenengrad;

    @Override
    public RowKind getKind() {
        return RowKind.BLUR;
    }

    @Override
    public Integer getGroup() {
        return null;
    }

    @Override
    public String getKeep() {
        return null;
    }

    @Override
    public String getRelation() {
        if (tenengrad == null) {
            return String.format(Locale.ROOT, "blur_value=%.6f", blurScore);
        }
        return String.format(Locale.ROOT, "blur_value=%.6f; tenengrad=%.6f", blurScore, tenengrad);
    }
}
