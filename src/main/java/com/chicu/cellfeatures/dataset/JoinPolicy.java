package com.chicu.cellfeatures.dataset;

/**
 * Как склеивать таблицы разных вариантов по колонке file.
 */
public enum JoinPolicy {
    /** прогон остаётся, только если он есть во всех вариантах */
    INNER,
    /** частичные строки: недостающие числа = NaN, текст = null */
    OUTER
}
