package com.myorg.docinsight.service.ranking;

import com.myorg.docinsight.model.RankedSection;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

@Getter
@ToString
public class RankingResult {

    private final List<RankedSection> ranked;

    // true when the deadline stopped scoring before every section was seen
    private final boolean truncated;

    public RankingResult(List<RankedSection> ranked, boolean truncated) {
        this.ranked = List.copyOf(ranked);
        this.truncated = truncated;
    }

    public static RankingResult empty() {
        return new RankingResult(List.of(), false);
    }
}
