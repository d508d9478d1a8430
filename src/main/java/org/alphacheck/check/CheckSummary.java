package org.alphacheck.check;

import java.util.List;

/**
 * Reports for all assets of one check, in the order the assets were given.
 *
 * @param reports one report per asset
 */
public record CheckSummary(List<AssetReport> reports) {

    public CheckSummary {
        reports = List.copyOf(reports);
    }

    /**
     * @return {@code true} if every asset was found, decoded and found to be transparent
     */
    public boolean passed() {
        return reports.stream().allMatch(AssetReport::passed);
    }

    public List<AssetReport> failures() {
        return reports.stream().filter(report -> !report.passed()).toList();
    }
}
