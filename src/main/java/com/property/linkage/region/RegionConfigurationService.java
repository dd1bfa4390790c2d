package com.property.linkage.region;

import java.util.List;

/**
 * Source of per-region configuration.
 */
public interface RegionConfigurationService {

    /**
     * @param regionKey region directory name
     * @return the region's configuration
     * @throws ConfigurationException if the region is unknown
     */
    RegionConfig getRegion(String regionKey);

    /**
     * All regions, sorted by display name.
     */
    List<RegionConfig> listRegions();
}
