package de.bsommerfeld.harvester.core.domain;

import java.util.List;

/**
 * Final, ordered result of a harvest run.
 *
 * @param view          shape of the report
 * @param groups        folder groups for {@link ReportView#GROUPED}, empty otherwise
 * @param assets        all assets in output order
 * @param totalComments number of comments across all assets
 * @param generatedAt   ISO-8601 generation time
 * @param complete      {@code false} if assets remain unprocessed and the run
 *                      can be resumed
 */
public record HarvestReport(
        ReportView view,
        List<FolderGroup> groups,
        List<AssetReport> assets,
        int totalComments,
        String generatedAt,
        boolean complete) {

    public HarvestReport {
        groups = List.copyOf(groups);
        assets = List.copyOf(assets);
    }
}
