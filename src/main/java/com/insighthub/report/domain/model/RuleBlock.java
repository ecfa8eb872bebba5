package com.insighthub.report.domain.model;

/**
 * Horizontal separator line spanning the content width, centered vertically in its slot.
 *
 * @param height    vertical space reserved for the rule
 * @param color     stroke color
 * @param lineWidth stroke width in points
 */
public record RuleBlock(float height, RgbColor color, float lineWidth) implements ContentBlock {

    public RuleBlock {
        if (!(height > 0)) {
            throw new IllegalArgumentException("Rule height must be positive: " + height);
        }
        if (!(lineWidth > 0)) {
            throw new IllegalArgumentException("Rule line width must be positive: " + lineWidth);
        }
        color = color == null ? RgbColor.BLACK : color;
    }

    @Override
    public BlockKind kind() {
        return BlockKind.RULE;
    }
}
