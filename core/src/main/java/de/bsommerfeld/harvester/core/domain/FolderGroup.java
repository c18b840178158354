package de.bsommerfeld.harvester.core.domain;

import java.util.List;

/**
 * Assets sharing a resolved folder path, in report order.
 */
public record FolderGroup(String path, List<AssetReport> assets) {

    public FolderGroup {
        assets = List.copyOf(assets);
    }
}
