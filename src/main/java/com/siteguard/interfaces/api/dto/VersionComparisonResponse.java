package com.siteguard.interfaces.api.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VersionComparisonResponse {

    private String left;
    private String right;
    /** LESS, EQUAL or GREATER: the left version relative to the right one. */
    private String ordering;
    private boolean leftParseable;
    private boolean rightParseable;
    private String leftBranch;
    private String rightBranch;
    private boolean sameBranch;
    /** Whether right is an eligible upgrade of left under the configured branch policy. */
    private boolean upgrade;
}
