package com.insighthub.report.domain.model;

/**
 * Blank vertical gap. A spacer that does not fit is dropped together with the page break it
 * would have straddled.
 */
public record SpacerBlock(float height) implements ContentBlock {

    public SpacerBlock {
        if (height < 0) {
            throw new IllegalArgumentException("Spacer height must not be negative: " + height);
        }
    }

    @Override
    public BlockKind kind() {
        return BlockKind.SPACER;
    }
}
