package com.insighthub.report.domain.model;

/**
 * A finished report held in memory together with its layout outcome.
 */
public record RenderedReport(byte[] content, LayoutResult layout) {

    public int pageCount() {
        return layout.pageCount();
    }
}
