package com.company.timeseries.dto.response;

import com.company.timeseries.domain.MeasurementPoint;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * One page of a filled coverage series.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CoverageTrendResponse {
    private int count;
    private Integer next;
    private Integer previous;

    @JsonProperty("total_pages")
    private int totalPages;

    private List<MeasurementPoint> results;

    /**
     * Page {@code page} (1-based) of {@code series}. Pages past the end are empty.
     */
    public static CoverageTrendResponse of(List<MeasurementPoint> series, int page, int pageSize) {
        int totalPages = Math.max(1, (series.size() + pageSize - 1) / pageSize);
        int from = (int) Math.min(series.size(), (long) (page - 1) * pageSize);
        int to = Math.min(series.size(), from + pageSize);

        return CoverageTrendResponse.builder()
                .count(series.size())
                .totalPages(totalPages)
                .next(page < totalPages ? page + 1 : null)
                .previous(page > 1 ? page - 1 : null)
                .results(series.subList(from, to))
                .build();
    }
}
