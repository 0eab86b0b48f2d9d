package guraa.photoclean.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

/**
 * Base class for the rows a scan emits. Exactly two kinds exist:
 * {@link BlurRow} and {@link DuplicateRow}. Consumers such as a trash step
 * or a report renderer only ever act on the candidate path.
 * <p>
 * The JSON form is {@code {kind, group, keep, candidate, relation}}; the typed
 * fields of the subclasses are what the core itself works with.
 */
@Getter
@SuperBuilder
@EqualsAndHashCode
@ToString
@JsonPropertyOrder({"kind", "group", "keep", "candidate", "relation"})
public abstract class ScanRow {

    /**
     * The path a downstream consumer may act on.
     */
    @JsonProperty("candidate")
    private final String candidate;

    @JsonProperty("kind")
    public abstract RowKind getKind();

    /**
     * Group identifier, or null for rows that do not belong to a group.
     */
    @JsonProperty("group")
    public abstract Integer getGroup();

    /**
     * The survivor of the group, or null for rows that do not belong to a group.
     */
    @JsonProperty("keep")
    public abstract String getKeep();

    /**
     * Text form of the row's measurements, used only at the external edge.
     */
    @JsonProperty("relation")
    public abstract String getRelation();
}
