package de.bsommerfeld.harvester.core.domain;

import java.util.Objects;

/**
 * Input of a harvest run as supplied by the caller.
 *
 * @param token                       opaque API token, already validated
 * @param projectId                   project to harvest
 * @param nameFilter                  comma-separated terms, all of which must
 *                                    occur in an asset name; {@code null} or
 *                                    blank accepts everything
 * @param includeHistoricalContainers when {@code false}, containers whose name
 *                                    marks them as historical are skipped
 * @param view                        requested report shape
 */
public record HarvestRequest(
        String token,
        String projectId,
        String nameFilter,
        boolean includeHistoricalContainers,
        ReportView view) {

    public HarvestRequest {
        Objects.requireNonNull(projectId, "projectId");
        view = view != null ? view : ReportView.GROUPED;
    }

    @Override
    public String toString() {
        // Keep the token out of log output
        return "HarvestRequest[projectId=" + projectId + ", nameFilter=" + nameFilter
                + ", includeHistoricalContainers=" + includeHistoricalContainers + ", view=" + view + "]";
    }
}
