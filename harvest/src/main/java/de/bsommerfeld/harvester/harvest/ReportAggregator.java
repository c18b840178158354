package de.bsommerfeld.harvester.harvest;

import com.google.inject.Singleton;
import de.bsommerfeld.harvester.core.domain.AssetReport;
import de.bsommerfeld.harvester.core.domain.FolderGroup;
import de.bsommerfeld.harvester.core.domain.HarvestReport;
import de.bsommerfeld.harvester.core.domain.ReportView;
import jakarta.inject.Inject;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Orders asset reports into the final report.
 *
 * <ul>
 * <li>{@link ReportView#GROUPED}: one group per folder path, groups sorted
 * by path, assets by name.</li>
 * <li>{@link ReportView#RECENT_FIRST}: a flat list, most recently commented
 * asset first.</li>
 * </ul>
 */
@Singleton
public class ReportAggregator {

    static final Comparator<AssetReport> BY_NAME = Comparator
            .comparing(AssetReport::name, String.CASE_INSENSITIVE_ORDER)
            .thenComparing(AssetReport::name)
            .thenComparing(AssetReport::assetId);

    static final Comparator<AssetReport> MOST_RECENT_FIRST = Comparator
            .comparing(AssetReport::latestActivity, Comparator.reverseOrder())
            .thenComparing(BY_NAME);

    private final Clock clock;

    @Inject
    public ReportAggregator(Clock clock) {
        this.clock = clock;
    }

    public HarvestReport aggregate(List<AssetReport> assets, ReportView view, boolean complete) {
        int totalComments = assets.stream().mapToInt(asset -> asset.comments().size()).sum();
        String generatedAt = Instant.now(clock).toString();

        if (view == ReportView.RECENT_FIRST) {
            List<AssetReport> ordered = new ArrayList<>(assets);
            ordered.sort(MOST_RECENT_FIRST);
            return new HarvestReport(view, List.of(), ordered, totalComments, generatedAt, complete);
        }

        Map<String, List<AssetReport>> byPath = new TreeMap<>();
        for (AssetReport asset : assets) {
            String path = asset.folderPath() != null ? asset.folderPath() : "/";
            byPath.computeIfAbsent(path, key -> new ArrayList<>()).add(asset);
        }

        List<FolderGroup> groups = new ArrayList<>(byPath.size());
        List<AssetReport> flattened = new ArrayList<>(assets.size());
        for (Map.Entry<String, List<AssetReport>> entry : byPath.entrySet()) {
            List<AssetReport> members = entry.getValue();
            members.sort(BY_NAME);
            groups.add(new FolderGroup(entry.getKey(), members));
            flattened.addAll(members);
        }
        return new HarvestReport(ReportView.GROUPED, groups, flattened, totalComments, generatedAt, complete);
    }
}
