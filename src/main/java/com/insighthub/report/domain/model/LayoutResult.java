package com.insighthub.report.domain.model;

import java.util.List;

/**
 * Outcome of laying out a report: how many physical pages were produced and where every
 * placed unit of content landed.
 */
public record LayoutResult(int pageCount, List<BlockPlacement> placements) {

    public LayoutResult {
        placements = placements == null ? List.of() : List.copyOf(placements);
    }

    public List<BlockPlacement> placementsOnPage(int pageNumber) {
        return placements.stream()
                .filter(placement -> placement.pageNumber() == pageNumber)
                .toList();
    }
}
