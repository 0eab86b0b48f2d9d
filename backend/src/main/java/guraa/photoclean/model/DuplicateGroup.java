package guraa.photoclean.model;

import lombok.Value;

import java.util.List;

/**
 * Connected component of similar images with the chosen survivor.
 * The keeper never appears among the candidates and every group has
 * at least one candidate.
 */
@Value
public class DuplicateGroup {

    int id;
    String keep;
    List<String> candidates;
}
