package de.jwiegmann.archive.control.pipeline.dedup;

import de.jwiegmann.archive.entity.DedupMethod;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
@AllArgsConstructor
public class DedupMatch {

    private final String duplicateOf;
    private final DedupMethod method;
    private final int distance;   // 0 bei EXACT

    public static DedupMatch exact(String duplicateOf) {
        return new DedupMatch(duplicateOf, DedupMethod.EXACT, 0);
    }

    public static DedupMatch near(String duplicateOf, int distance) {
        return new DedupMatch(duplicateOf, DedupMethod.NEAR, distance);
    }
}
