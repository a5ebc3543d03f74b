package com.chicu.cellfeatures.features;

import com.chicu.cellfeatures.common.enums.FeatureType;
import com.chicu.cellfeatures.features.diagnostic.HppcRelaxationExtractor;
import com.chicu.cellfeatures.features.fastcharge.DeltaQFastChargeExtractor;
import com.chicu.cellfeatures.features.fastcharge.TrajectoryFastChargeExtractor;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class FeatureExtractorRegistryTest {

    @Test
    void get_shouldReturnExtractorByType() {
        DeltaQFastChargeExtractor deltaQ = new DeltaQFastChargeExtractor();
        FeatureExtractorRegistry registry = new FeatureExtractorRegistry(
                List.of(deltaQ, new TrajectoryFastChargeExtractor()));

        assertSame(deltaQ, registry.get(FeatureType.DELTA_Q_FAST_CHARGE));
        assertEquals(Set.of(FeatureType.DELTA_Q_FAST_CHARGE, FeatureType.TRAJECTORY_FAST_CHARGE), registry.types());
    }

    @Test
    void get_shouldFail_whenTypeNotRegistered() {
        FeatureExtractorRegistry registry = new FeatureExtractorRegistry(List.of(new HppcRelaxationExtractor()));
        assertThrows(IllegalArgumentException.class, () -> registry.get(FeatureType.RPT_DQDV));
    }

    @Test
    void constructor_shouldKeepLast_whenTypeDuplicated() {
        HppcRelaxationExtractor first = new HppcRelaxationExtractor();
        HppcRelaxationExtractor second = new HppcRelaxationExtractor();

        FeatureExtractorRegistry registry = new FeatureExtractorRegistry(List.of(first, second));

        assertSame(second, registry.get(FeatureType.HPPC_RELAXATION));
    }

    @Test
    void fromTag_shouldAcceptTagOrEnumName() {
        assertEquals(FeatureType.RPT_DQDV, FeatureType.fromTag("RPTdQdVFeatures"));
        assertEquals(FeatureType.RPT_DQDV, FeatureType.fromTag("RPT_DQDV"));
        assertThrows(IllegalArgumentException.class, () -> FeatureType.fromTag("Unknown"));
    }
}
