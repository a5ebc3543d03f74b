package com.chicu.cellfeatures.dataset.split;

public enum SplitMode {
    /** прогон целиком уходит либо в train, либо в test (без утечек между строками одной ячейки) */
    BY_RUN,
    /** независимое перемешивание строк */
    BY_ROW
}
