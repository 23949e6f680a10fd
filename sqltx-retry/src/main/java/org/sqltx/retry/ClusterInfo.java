package org.sqltx.retry;

import java.util.List;
import java.util.Objects;

/**
 * What the cluster reports about itself.
 */
public final class ClusterInfo {

    private final String version;
    private final String fullVersion;
    private final List<String> regions;

    public ClusterInfo(String version, String fullVersion, List<String> regions) {
        this.version = version;
        this.fullVersion = fullVersion;
        this.regions = regions != null ? List.copyOf(regions) : List.of();
    }

    /**
     * @return the release token of {@code version()}, e.g. {@code v23.1.0}, or the whole
     *         string when it carries no such token
     */
    public String getVersion() {
        return version;
    }

    public String getFullVersion() {
        return fullVersion;
    }

    /**
     * @return the database regions, empty for single-region clusters or when the server
     *         does not support {@code SHOW REGIONS}
     */
    public List<String> getRegions() {
        return regions;
    }

    public boolean isMultiRegion() {
        return regions.size() > 1;
    }

    /**
     * Extracts the first whitespace separated token of the form {@code v<digit>...}.
     */
    static String parseVersion(String fullVersion) {
        if (fullVersion == null) {
            return null;
        }
        for (String token : fullVersion.trim().split("\\s+")) {
            if (token.length() > 1 && token.charAt(0) == 'v' && Character.isDigit(token.charAt(1))) {
                return token;
            }
        }
        return fullVersion.trim();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ClusterInfo)) {
            return false;
        }
        ClusterInfo that = (ClusterInfo) o;
        return Objects.equals(version, that.version)
                && Objects.equals(fullVersion, that.fullVersion)
                && regions.equals(that.regions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(version, fullVersion, regions);
    }

    @Override
    public String toString() {
        return "ClusterInfo{" +
                "version='" + version + '\'' +
                ", regions=" + regions +
                '}';
    }
}
