package com.chicu.cellfeatures.config;

import com.chicu.cellfeatures.common.enums.FeatureType;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@Data
@ConfigurationProperties(prefix = "cellfeatures")
public class CellFeaturesProperties {

    private Storage storage = new Storage();

    /**
     * Таблица гиперпараметров по умолчанию (Spring resource location).
     */
    private String hyperparametersLocation = "classpath:feature-hyperparameters.yml";

    private Batch batch = new Batch();

    @Data
    public static class Storage {
        private String featureDir = "./data-share/features";
        private String datasetDir = "./data-share/datasets";
        private String parametersDir = "./data-share/raw/parameters";
    }

    @Data
    public static class Batch {
        /**
         * JSON задания или путь к .json; пусто: раннер не запускается.
         */
        private String job;

        /**
         * Варианты, которые считает пакетный прогон.
         */
        private List<FeatureType> types = new ArrayList<>(List.of(
                FeatureType.DELTA_Q_FAST_CHARGE,
                FeatureType.TRAJECTORY_FAST_CHARGE,
                FeatureType.DIAGNOSTIC_CYCLES,
                FeatureType.DIAGNOSTIC_PROPERTIES
        ));
    }
}
