package com.myorg.docinsight.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

@Getter
@Builder(toBuilder = true)
@ToString
public class RankedSection {

    private final Section section;

    private final double score;

    private final int importanceRank;

    // false when the deadline expired before this section was scored
    private final boolean scored;
}
